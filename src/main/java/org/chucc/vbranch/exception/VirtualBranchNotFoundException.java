package org.chucc.vbranch.exception;

import org.chucc.vbranch.domain.BranchId;

/**
 * Exception thrown when a requested virtual branch does not exist.
 */
public class VirtualBranchNotFoundException extends VbranchException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructor with branch id.
   *
   * @param id the id of the branch that was not found
   */
  public VirtualBranchNotFoundException(BranchId id) {
    super("Virtual branch not found: " + id, ErrorKind.BRANCH_NOT_FOUND);
  }
}
