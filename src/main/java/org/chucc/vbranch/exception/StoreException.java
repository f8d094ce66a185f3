package org.chucc.vbranch.exception;

/**
 * Exception thrown when the underlying key/value store fails to read or write.
 * The store's own failure is passed through as the cause.
 */
public class StoreException extends VbranchException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructor with message.
   *
   * @param message error message
   */
  public StoreException(String message) {
    super(message, ErrorKind.STORE);
  }

  /**
   * Constructor with message and cause.
   *
   * @param message error message
   * @param cause the cause
   */
  public StoreException(String message, Throwable cause) {
    super(message, ErrorKind.STORE, cause);
  }
}
