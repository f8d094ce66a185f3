package org.chucc.vbranch.repository;

/**
 * Write access to the fields of one record.
 */
@FunctionalInterface
public interface RecordWriter {

  /**
   * Applies a batch atomically: once this returns, every operation is visible to
   * subsequent reads; if it throws, none is.
   *
   * @param batch the operations, keys relative to the record root
   * @throws org.chucc.vbranch.exception.StoreException if the store cannot be written
   */
  void commit(WriteBatch batch);
}
