package org.chucc.vbranch.exception;

/**
 * Exception thrown when identifier text is not a valid encoding.
 */
public class MalformedIdentifierException extends VbranchException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructor with the rejected text and the parse failure.
   *
   * @param text the rejected identifier text
   * @param cause the parse failure
   */
  public MalformedIdentifierException(String text, Throwable cause) {
    super("Malformed identifier: " + text, ErrorKind.MALFORMED_IDENTIFIER, cause);
  }
}
