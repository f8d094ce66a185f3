package org.chucc.vbranch.exception;

/**
 * Exception thrown when ownership text cannot be decomposed into file and hunk entries.
 */
public class OwnershipParseException extends VbranchException {

  private static final long serialVersionUID = 1L;

  private final String fragment;

  /**
   * Constructor with the offending fragment and a reason.
   *
   * @param fragment the part of the text that failed to parse
   * @param reason what is wrong with it
   */
  public OwnershipParseException(String fragment, String reason) {
    super("Invalid ownership '" + fragment + "': " + reason, ErrorKind.OWNERSHIP_PARSE);
    this.fragment = fragment;
  }

  /**
   * Constructor with the offending fragment and the parse failure.
   *
   * @param fragment the part of the text that failed to parse
   * @param cause the parse failure
   */
  public OwnershipParseException(String fragment, Throwable cause) {
    super("Invalid ownership '" + fragment + "': " + cause.getMessage(),
        ErrorKind.OWNERSHIP_PARSE, cause);
    this.fragment = fragment;
  }

  public String getFragment() {
    return fragment;
  }
}
