package org.chucc.vbranch.exception;

/**
 * Closed set of failure kinds raised by the virtual branch store.
 * Callers branch on the kind instead of parsing messages.
 */
public enum ErrorKind {
  /** A mandatory key is missing from a stored record. */
  NOT_FOUND("field_not_found"),
  /** A key is present but its content fails typed parsing. */
  INVALID("field_invalid"),
  /** Identifier text fails its own format check. */
  MALFORMED_IDENTIFIER("malformed_identifier"),
  /** Ownership text cannot be decomposed into file and hunk entries. */
  OWNERSHIP_PARSE("ownership_parse_error"),
  /** The underlying store failed. */
  STORE("store_error"),
  /** No record exists for the requested branch id. */
  BRANCH_NOT_FOUND("branch_not_found");

  private final String code;

  ErrorKind(String code) {
    this.code = code;
  }

  /**
   * Gets the canonical error code.
   *
   * @return the error code
   */
  public String code() {
    return code;
  }
}
