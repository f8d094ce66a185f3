package org.chucc.vbranch.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.chucc.vbranch.domain.Ownership;

/**
 * Request DTO for creating a virtual branch.
 * Every field is optional; absent fields are filled with defaults on creation.
 *
 * @param name the branch name, or null for a generated default
 * @param ownership the hunks to claim, or null for none
 * @param order the display order, or null for the next available position
 */
public record BranchCreateRequest(
    @JsonProperty("name") String name,
    @JsonProperty("ownership") Ownership ownership,
    @JsonProperty("order") Integer order
) {

  /**
   * Creates a request with every field unset.
   *
   * @return the request
   */
  public static BranchCreateRequest empty() {
    return new BranchCreateRequest(null, null, null);
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
