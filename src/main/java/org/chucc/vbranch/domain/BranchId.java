package org.chucc.vbranch.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.github.f4b6a3.uuid.UuidCreator;
import java.util.Objects;
import java.util.UUID;
import org.chucc.vbranch.exception.MalformedIdentifierException;

/**
 * Value object identifying a virtual branch record, backed by a UUIDv7 (time-based).
 * Distinct from every other identifier kind so branch ids cannot be mixed up with object ids.
 */
public record BranchId(UUID value) {

  /**
   * Creates a new BranchId.
   *
   * @param value the UUID (must be non-null)
   */
  public BranchId {
    Objects.requireNonNull(value, "BranchId value cannot be null");
  }

  /**
   * Generates a new BranchId using UUIDv7 (time-based epoch generator).
   *
   * @return a fresh BranchId
   */
  public static BranchId generate() {
    return new BranchId(UuidCreator.getTimeOrderedEpoch());
  }

  /**
   * Parses a BranchId from its canonical text form.
   *
   * @param text the UUID text
   * @return the parsed BranchId
   * @throws MalformedIdentifierException if text is null, blank, or not a canonical UUID
   */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static BranchId parse(String text) {
    if (text == null || text.isBlank()) {
      throw new MalformedIdentifierException(String.valueOf(text),
          new IllegalArgumentException("BranchId cannot be blank"));
    }
    UUID uuid;
    try {
      uuid = UUID.fromString(text);
    } catch (IllegalArgumentException e) {
      throw new MalformedIdentifierException(text, e);
    }
    // UUID.fromString accepts short groups such as "1-1-1-1-1"; only the canonical form round-trips
    if (!uuid.toString().equalsIgnoreCase(text)) {
      throw new MalformedIdentifierException(text,
          new IllegalArgumentException("BranchId must be a canonical UUID"));
    }
    return new BranchId(uuid);
  }

  @JsonValue
  @Override
  public String toString() {
    return value.toString();
  }
}
