package org.chucc.vbranch.exception;

/**
 * Exception thrown when a hunk is constructed with a malformed line range.
 */
public class InvalidRangeException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructor with the rejected range.
   *
   * @param start the start line
   * @param end the end line
   */
  public InvalidRangeException(int start, int end) {
    super("Invalid hunk range " + start + "-" + end
        + ": start must be non-negative and end must not precede start");
  }
}
