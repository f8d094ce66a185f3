package org.chucc.vbranch.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Value object for the textual form of a version-control object id (tree or commit).
 * Only the 40-character hexadecimal SHA-1 form is accepted; the value is kept lower-case.
 */
public record Oid(String value) {

  private static final Pattern HEX_40 = Pattern.compile("^[0-9a-f]{40}$");

  /**
   * Creates a new Oid with validation.
   *
   * @param value the hex string (must be non-null and exactly 40 hex characters)
   * @throws IllegalArgumentException if value is not a valid object id
   */
  public Oid {
    Objects.requireNonNull(value, "Oid value cannot be null");
    value = value.toLowerCase(Locale.ROOT);
    if (!HEX_40.matcher(value).matches()) {
      throw new IllegalArgumentException(
          "Oid must be 40 hexadecimal characters: '" + value + "'");
    }
  }

  /**
   * Creates an Oid from its text form.
   *
   * @param value the hex string
   * @return a new Oid
   * @throws IllegalArgumentException if value is invalid
   */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static Oid of(String value) {
    return new Oid(value);
  }

  @JsonValue
  @Override
  public String toString() {
    return value;
  }
}
