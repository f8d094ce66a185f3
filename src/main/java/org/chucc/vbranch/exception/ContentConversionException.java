package org.chucc.vbranch.exception;

/**
 * Exception thrown when stored content cannot be converted to the requested type,
 * either because it has the wrong shape (binary instead of text) or fails to parse.
 */
public class ContentConversionException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructor with message.
   *
   * @param message error message
   */
  public ContentConversionException(String message) {
    super(message);
  }

  /**
   * Constructor with message and cause.
   *
   * @param message error message
   * @param cause the cause
   */
  public ContentConversionException(String message, Throwable cause) {
    super(message, cause);
  }
}
