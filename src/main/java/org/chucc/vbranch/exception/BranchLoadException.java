package org.chucc.vbranch.exception;

/**
 * Exception thrown when a stored branch record cannot be reconstructed.
 * Always names the key whose value was missing or unreadable.
 */
public class BranchLoadException extends VbranchException {

  private static final long serialVersionUID = 1L;

  private final String field;

  private BranchLoadException(String message, ErrorKind kind, String field, Throwable cause) {
    super(message, kind, cause);
    this.field = field;
  }

  /**
   * Creates an exception for a mandatory key that is absent.
   *
   * @param field the missing key
   * @return the exception
   */
  public static BranchLoadException notFound(String field) {
    return new BranchLoadException(field + ": not found", ErrorKind.NOT_FOUND, field, null);
  }

  /**
   * Creates an exception for a key whose content failed to parse or could not be read.
   *
   * @param field the offending key
   * @param cause the underlying failure
   * @return the exception
   */
  public static BranchLoadException invalid(String field, Throwable cause) {
    return new BranchLoadException(
        field + ": " + cause.getMessage(), ErrorKind.INVALID, field, cause);
  }

  /**
   * Gets the key name that caused the failure.
   *
   * @return the key name
   */
  public String getField() {
    return field;
  }
}
