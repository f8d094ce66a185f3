package org.chucc.vbranch.repository;

import java.util.Arrays;
import java.util.Objects;
import org.chucc.vbranch.exception.ContentConversionException;

/**
 * A value held by the key/value store: either UTF-8 text or raw bytes.
 * Conversions are explicit and fail with {@link ContentConversionException} on a shape
 * or format mismatch; nothing is coerced implicitly.
 */
public sealed interface Content permits Content.Utf8, Content.Binary {

  /**
   * Wraps text content.
   *
   * @param text the text
   * @return the content
   */
  static Content of(String text) {
    return new Utf8(text);
  }

  /**
   * Wraps an unsigned integer as decimal text.
   *
   * @param value the value (must be >= 0)
   * @return the content
   */
  static Content of(long value) {
    if (value < 0) {
      throw new IllegalArgumentException("Value must be unsigned: " + value);
    }
    return new Utf8(Long.toString(value));
  }

  /**
   * Wraps a boolean as {@code true} or {@code false}.
   *
   * @param value the value
   * @return the content
   */
  static Content of(boolean value) {
    return new Utf8(Boolean.toString(value));
  }

  /**
   * Gets the content as text.
   *
   * @return the text
   * @throws ContentConversionException if the content is binary
   */
  String asText();

  /**
   * Gets the content as a boolean, accepting exactly {@code true} or {@code false}.
   *
   * @return the boolean
   * @throws ContentConversionException if the content is binary or not a boolean
   */
  default boolean asBoolean() {
    String text = asText();
    if ("true".equals(text)) {
      return true;
    }
    if ("false".equals(text)) {
      return false;
    }
    throw new ContentConversionException("expected 'true' or 'false', got '" + text + "'");
  }

  /**
   * Gets the content as an unsigned decimal long.
   *
   * @return the value
   * @throws ContentConversionException if the content is binary or not an unsigned integer
   */
  default long asUnsignedLong() {
    String text = asText();
    if (text.isEmpty() || !text.chars().allMatch(c -> c >= '0' && c <= '9')) {
      throw new ContentConversionException("expected an unsigned integer, got '" + text + "'");
    }
    try {
      return Long.parseLong(text);
    } catch (NumberFormatException e) {
      throw new ContentConversionException("integer out of range: '" + text + "'", e);
    }
  }

  /**
   * Gets the content as an unsigned decimal int.
   *
   * @return the value
   * @throws ContentConversionException if the content is binary, not an unsigned integer,
   *     or larger than {@link Integer#MAX_VALUE}
   */
  default int asUnsignedInt() {
    long value = asUnsignedLong();
    if (value > Integer.MAX_VALUE) {
      throw new ContentConversionException("integer out of range: " + value);
    }
    return (int) value;
  }

  /**
   * UTF-8 text content.
   *
   * @param text the text
   */
  record Utf8(String text) implements Content {

    public Utf8 {
      Objects.requireNonNull(text, "Text content cannot be null");
    }

    @Override
    public String asText() {
      return text;
    }
  }

  /**
   * Raw byte content.
   *
   * @param bytes the bytes (copied)
   */
  record Binary(byte[] bytes) implements Content {

    public Binary {
      Objects.requireNonNull(bytes, "Binary content cannot be null");
      bytes = bytes.clone();
    }

    @Override
    public byte[] bytes() {
      return bytes.clone();
    }

    @Override
    public String asText() {
      throw new ContentConversionException(
          "expected UTF-8 text, got " + bytes.length + " bytes of binary content");
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Binary other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
      return "Binary[" + bytes.length + " bytes]";
    }
  }
}
