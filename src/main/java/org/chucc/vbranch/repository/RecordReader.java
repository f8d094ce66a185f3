package org.chucc.vbranch.repository;

import java.util.Optional;

/**
 * Read-only, key-addressed access to the stored fields of one record.
 */
@FunctionalInterface
public interface RecordReader {

  /**
   * Reads the content stored under a key.
   *
   * @param key the key, relative to the record root (e.g. {@code meta/name})
   * @return the content, or empty if nothing is stored under the key
   * @throws org.chucc.vbranch.exception.StoreException if the store cannot be read
   */
  Optional<Content> read(String key);
}
