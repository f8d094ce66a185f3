package org.chucc.vbranch.repository;

import java.util.List;

/**
 * A generic key/value store holding records under "/"-separated key roots.
 * Implementations guarantee that a committed batch is applied atomically.
 */
public interface KeyValueStore {

  /**
   * Opens a reader scoped to a record root.
   *
   * @param root the record root, without trailing "/"
   * @return a reader resolving keys below the root
   */
  RecordReader reader(String root);

  /**
   * Opens a writer scoped to a record root.
   *
   * @param root the record root, without trailing "/"
   * @return a writer resolving keys below the root
   */
  RecordWriter writer(String root);

  /**
   * Lists the distinct child names directly below a root.
   *
   * @param root the root, without trailing "/"
   * @return the child names in ascending order
   */
  List<String> children(String root);

  /**
   * Removes every key below a root.
   *
   * @param root the root, without trailing "/"
   * @return true if any key was removed
   */
  boolean deleteAll(String root);
}
