package org.chucc.vbranch.domain;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;
import org.chucc.vbranch.exception.InvalidRangeException;

/**
 * A contiguous, inclusive line range within one file plus a fingerprint of its content.
 * The unit of ownership. The hash is optional so that entries written before
 * fingerprints existed still load.
 *
 * @param start first line of the range
 * @param end last line of the range (inclusive, never before start)
 * @param hash lower-case hex fingerprint of the hunk content, or null
 */
public record Hunk(int start, int end, String hash) implements Comparable<Hunk> {

  private static final Pattern HEX = Pattern.compile("^[0-9a-f]+$");

  /**
   * Creates a new Hunk with validation.
   *
   * @throws InvalidRangeException if start is negative or end precedes start
   * @throws IllegalArgumentException if hash is present but not hexadecimal
   */
  public Hunk {
    if (start < 0 || end < start) {
      throw new InvalidRangeException(start, end);
    }
    if (hash != null) {
      hash = hash.toLowerCase(Locale.ROOT);
      if (!HEX.matcher(hash).matches()) {
        throw new IllegalArgumentException("Hunk hash must be hexadecimal: '" + hash + "'");
      }
    }
  }

  /**
   * Creates a hunk without a fingerprint.
   *
   * @param start first line
   * @param end last line
   * @return a new Hunk
   */
  public static Hunk of(int start, int end) {
    return new Hunk(start, end, null);
  }

  /**
   * Creates a hunk fingerprinted from its diff content.
   *
   * @param start first line
   * @param end last line
   * @param content the hunk's diff text
   * @return a new Hunk
   */
  public static Hunk of(int start, int end, String content) {
    return new Hunk(start, end, fingerprint(content));
  }

  /**
   * Computes the MD5 fingerprint of hunk content.
   *
   * @param content the hunk's diff text
   * @return 32 lower-case hex characters
   */
  public static String fingerprint(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("MD5");
      return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("MD5 algorithm not available", e);
    }
  }

  /**
   * Parses the text form {@code start-end} or {@code start-end-hash}.
   *
   * @param text the hunk text
   * @return the parsed Hunk
   * @throws IllegalArgumentException if the text is malformed
   */
  public static Hunk parse(String text) {
    String[] parts = text.split("-", -1);
    if (parts.length < 2 || parts.length > 3) {
      throw new IllegalArgumentException("Hunk must be 'start-end' or 'start-end-hash'");
    }
    int start = parseLine(parts[0]);
    int end = parseLine(parts[1]);
    String hash = parts.length == 3 ? parts[2] : null;
    if (hash != null && hash.isEmpty()) {
      throw new IllegalArgumentException("Hunk hash cannot be empty");
    }
    return new Hunk(start, end, hash);
  }

  private static int parseLine(String text) {
    if (text.isEmpty() || !text.chars().allMatch(c -> c >= '0' && c <= '9')) {
      throw new IllegalArgumentException("Line number must be an unsigned integer: '"
          + text + "'");
    }
    return Integer.parseInt(text);
  }

  /**
   * Checks whether two inclusive ranges share at least one line.
   *
   * @param other the other hunk
   * @return true if the ranges intersect
   */
  public boolean overlaps(Hunk other) {
    return start <= other.end && other.start <= end;
  }

  @Override
  public int compareTo(Hunk other) {
    int byStart = Integer.compare(start, other.start);
    return byStart != 0 ? byStart : Integer.compare(end, other.end);
  }

  @Override
  public String toString() {
    return hash == null ? start + "-" + end : start + "-" + end + "-" + hash;
  }
}
