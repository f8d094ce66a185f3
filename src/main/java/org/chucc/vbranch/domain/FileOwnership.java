package org.chucc.vbranch.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import org.chucc.vbranch.exception.OwnershipParseException;

/**
 * The hunks of one file claimed by a branch.
 * Hunks are kept sorted ascending by start line and never overlap; inserting a hunk
 * that overlaps existing ones replaces them (last writer wins).
 */
public final class FileOwnership {

  private final String path;
  private final List<Hunk> hunks = new ArrayList<>();

  /**
   * Creates an empty FileOwnership for a path.
   *
   * @param path the file path relative to the working tree (must be non-null and non-blank)
   * @throws IllegalArgumentException if the path is blank or contains a line break
   */
  public FileOwnership(String path) {
    Objects.requireNonNull(path, "File path cannot be null");
    if (path.isBlank()) {
      throw new IllegalArgumentException("File path cannot be blank");
    }
    if (path.indexOf('\n') >= 0 || path.indexOf('\r') >= 0) {
      throw new IllegalArgumentException("File path cannot contain line breaks: " + path);
    }
    this.path = path;
  }

  /**
   * Creates a FileOwnership holding the given hunks, inserted in iteration order.
   *
   * @param path the file path
   * @param hunks the hunks to add
   */
  public FileOwnership(String path, Collection<Hunk> hunks) {
    this(path);
    hunks.forEach(this::add);
  }

  /**
   * Parses the text form {@code path:hunk,hunk,...}.
   * The path is everything before the last ":".
   *
   * @param text the entry text
   * @return the parsed FileOwnership
   * @throws OwnershipParseException if the entry is malformed
   */
  public static FileOwnership parse(String text) {
    int separator = text.lastIndexOf(':');
    if (separator < 0) {
      throw new OwnershipParseException(text, "missing ':' between path and hunks");
    }
    String hunksText = text.substring(separator + 1);
    if (hunksText.isEmpty()) {
      throw new OwnershipParseException(text, "no hunks listed");
    }
    FileOwnership ownership;
    try {
      ownership = new FileOwnership(text.substring(0, separator));
    } catch (IllegalArgumentException e) {
      throw new OwnershipParseException(text, e);
    }
    for (String hunkText : hunksText.split(",", -1)) {
      try {
        ownership.add(Hunk.parse(hunkText));
      } catch (IllegalArgumentException e) {
        throw new OwnershipParseException(hunkText, e);
      }
    }
    return ownership;
  }

  public String getPath() {
    return path;
  }

  /**
   * Gets the hunks in ascending start-line order.
   *
   * @return an unmodifiable view of the hunks
   */
  public List<Hunk> getHunks() {
    return Collections.unmodifiableList(hunks);
  }

  public boolean isEmpty() {
    return hunks.isEmpty();
  }

  /**
   * Inserts a hunk keeping sort order.
   * Every existing hunk overlapping the new one is dropped as a whole, even when the
   * overlap is partial.
   *
   * @param hunk the hunk to insert
   * @return the hunks that were replaced, in ascending order
   */
  public List<Hunk> add(Hunk hunk) {
    Objects.requireNonNull(hunk, "Hunk cannot be null");
    List<Hunk> replaced = removeOverlapping(hunk);
    int index = 0;
    while (index < hunks.size() && hunks.get(index).compareTo(hunk) < 0) {
      index++;
    }
    hunks.add(index, hunk);
    return replaced;
  }

  /**
   * Removes a hunk equal to the given one.
   *
   * @param hunk the hunk to remove
   * @return true if it was present
   */
  public boolean remove(Hunk hunk) {
    return hunks.remove(hunk);
  }

  /**
   * Removes every hunk that overlaps the given range.
   *
   * @param range the range to clear
   * @return the removed hunks, in ascending order
   */
  public List<Hunk> removeOverlapping(Hunk range) {
    List<Hunk> removed = new ArrayList<>();
    Iterator<Hunk> it = hunks.iterator();
    while (it.hasNext()) {
      Hunk existing = it.next();
      if (existing.overlaps(range)) {
        removed.add(existing);
        it.remove();
      }
    }
    return removed;
  }

  /**
   * Checks whether any hunk of this file overlaps the given range.
   *
   * @param range the range to test
   * @return true if some hunk overlaps it
   */
  public boolean overlaps(Hunk range) {
    return hunks.stream().anyMatch(h -> h.overlaps(range));
  }

  /**
   * Creates an independent copy.
   *
   * @return the copy
   */
  public FileOwnership copy() {
    FileOwnership copy = new FileOwnership(path);
    copy.hunks.addAll(hunks);
    return copy;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    FileOwnership other = (FileOwnership) obj;
    return path.equals(other.path) && hunks.equals(other.hunks);
  }

  @Override
  public int hashCode() {
    return Objects.hash(path, hunks);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(path).append(':');
    for (int i = 0; i < hunks.size(); i++) {
      if (i > 0) {
        sb.append(',');
      }
      sb.append(hunks.get(i));
    }
    return sb.toString();
  }
}
