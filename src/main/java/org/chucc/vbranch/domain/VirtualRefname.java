package org.chucc.vbranch.domain;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Synthetic reference name of a virtual branch, {@code refs/virtual/<branch>}.
 * It is a display and addressing convenience only; no such reference exists in the repository.
 */
public record VirtualRefname(String branch) {

  public static final String PREFIX = "refs/virtual/";

  private static final Pattern INVALID_RUN = Pattern.compile("[^A-Za-z0-9._\\-]+");

  /**
   * Creates a new VirtualRefname.
   *
   * @param branch the normalized branch component (must be non-null and non-blank)
   */
  public VirtualRefname {
    Objects.requireNonNull(branch, "Virtual refname branch cannot be null");
    if (branch.isBlank()) {
      throw new IllegalArgumentException("Virtual refname branch cannot be blank");
    }
  }

  /**
   * Derives the refname of a branch from its name, falling back to the id
   * when nothing of the name survives normalization.
   *
   * @param name the branch name
   * @param id the branch id
   * @return the derived refname
   */
  public static VirtualRefname derive(String name, BranchId id) {
    String normalized = normalize(name);
    return new VirtualRefname(normalized.isEmpty() ? id.toString() : normalized);
  }

  /**
   * Replaces every run of characters outside {@code [A-Za-z0-9._-]} with a single "-"
   * and trims leading and trailing "-" and ".".
   *
   * @param name the name to normalize
   * @return the normalized name, possibly empty
   */
  static String normalize(String name) {
    String replaced = INVALID_RUN.matcher(name).replaceAll("-");
    int start = 0;
    int end = replaced.length();
    while (start < end && isTrimmed(replaced.charAt(start))) {
      start++;
    }
    while (end > start && isTrimmed(replaced.charAt(end - 1))) {
      end--;
    }
    return replaced.substring(start, end);
  }

  private static boolean isTrimmed(char c) {
    return c == '-' || c == '.';
  }

  @Override
  public String toString() {
    return PREFIX + branch;
  }
}
