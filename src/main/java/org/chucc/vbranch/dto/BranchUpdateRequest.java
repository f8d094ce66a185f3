package org.chucc.vbranch.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;
import org.chucc.vbranch.domain.BranchId;
import org.chucc.vbranch.domain.Ownership;

/**
 * Request DTO for patching a virtual branch.
 * Only {@code id} is required; a null field leaves the stored value unchanged.
 *
 * @param id the branch to update
 * @param name the new name
 * @param notes the new notes
 * @param ownership the new ownership, replacing the current one
 * @param order the new display order
 * @param upstream the bare upstream branch name, e.g. {@code feature/x}, not a full
 *     {@code refs/remotes/...} reference
 */
public record BranchUpdateRequest(
    @JsonProperty("id") BranchId id,
    @JsonProperty("name") String name,
    @JsonProperty("notes") String notes,
    @JsonProperty("ownership") Ownership ownership,
    @JsonProperty("order") Integer order,
    @JsonProperty("upstream") String upstream
) {

  /**
   * Creates a new BranchUpdateRequest.
   *
   * @throws NullPointerException if id is null
   */
  public BranchUpdateRequest {
    Objects.requireNonNull(id, "Branch id is required");
  }

  /**
   * Validates the request fields.
   *
   * @throws IllegalArgumentException if validation fails
   */
  public void validate() {
    if (order != null && order < 0) {
      throw new IllegalArgumentException("Branch order cannot be negative: " + order);
    }
  }
}
