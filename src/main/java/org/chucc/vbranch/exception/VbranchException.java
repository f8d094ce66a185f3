package org.chucc.vbranch.exception;

import java.util.Objects;

/**
 * Base exception for virtual branch store errors.
 * Carries the error kind and its canonical error code.
 */
public class VbranchException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;

  /**
   * Constructor with message and kind.
   *
   * @param message error message
   * @param kind error kind
   */
  public VbranchException(String message, ErrorKind kind) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "Error kind cannot be null");
  }

  /**
   * Constructor with message, kind, and cause.
   *
   * @param message error message
   * @param kind error kind
   * @param cause the cause
   */
  public VbranchException(String message, ErrorKind kind, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "Error kind cannot be null");
  }

  public ErrorKind getKind() {
    return kind;
  }

  public String getCode() {
    return kind.code();
  }
}
