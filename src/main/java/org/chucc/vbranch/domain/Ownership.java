package org.chucc.vbranch.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The full set of file regions claimed by one branch, keyed by file path.
 *
 * <p>Text form: one {@link FileOwnership} entry per line ({@code path:hunk,hunk}), paths in
 * ascending order. The empty string is the empty ownership. Files without hunks are never
 * kept, so two ownerships are equal exactly when they claim the same hunks.
 */
public final class Ownership {

  private final Map<String, FileOwnership> files = new TreeMap<>();

  /**
   * Creates an empty Ownership.
   */
  public Ownership() {
    // empty
  }

  /**
   * Creates an Ownership holding the given file ownerships.
   *
   * @param files the file ownerships to put
   */
  public Ownership(List<FileOwnership> files) {
    files.forEach(this::put);
  }

  /**
   * Parses the text form.
   *
   * @param text the ownership text
   * @return the parsed Ownership
   * @throws org.chucc.vbranch.exception.OwnershipParseException if an entry is malformed
   */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static Ownership parse(String text) {
    Objects.requireNonNull(text, "Ownership text cannot be null");
    Ownership ownership = new Ownership();
    for (String line : text.split("\n")) {
      // blank lines carry no entry
      if (!line.isEmpty()) {
        ownership.put(FileOwnership.parse(line));
      }
    }
    return ownership;
  }

  public boolean isEmpty() {
    return files.isEmpty();
  }

  /**
   * Gets copies of the file ownerships in ascending path order.
   *
   * @return the file ownerships
   */
  public List<FileOwnership> getFiles() {
    List<FileOwnership> result = new ArrayList<>(files.size());
    files.values().forEach(f -> result.add(f.copy()));
    return result;
  }

  /**
   * Finds the ownership of one file.
   *
   * @param path the file path
   * @return a copy of the file's ownership, or empty if the path is not claimed
   */
  public Optional<FileOwnership> get(String path) {
    return Optional.ofNullable(files.get(path)).map(FileOwnership::copy);
  }

  /**
   * Claims a single hunk of a file.
   *
   * @param path the file path
   * @param hunk the hunk to claim
   * @return the hunks it replaced
   */
  public List<Hunk> add(String path, Hunk hunk) {
    return files.computeIfAbsent(path, FileOwnership::new).add(hunk);
  }

  /**
   * Claims every hunk of the given file ownership, overlap resolved per hunk.
   *
   * @param fileOwnership the hunks to claim
   */
  public void put(FileOwnership fileOwnership) {
    if (fileOwnership.isEmpty()) {
      return;
    }
    FileOwnership target = files.computeIfAbsent(fileOwnership.getPath(), FileOwnership::new);
    fileOwnership.getHunks().forEach(target::add);
  }

  /**
   * Drops exactly the given hunks; a file left without hunks is dropped too.
   *
   * @param fileOwnership the hunks to drop
   */
  public void remove(FileOwnership fileOwnership) {
    FileOwnership target = files.get(fileOwnership.getPath());
    if (target == null) {
      return;
    }
    fileOwnership.getHunks().forEach(target::remove);
    if (target.isEmpty()) {
      files.remove(fileOwnership.getPath());
    }
  }

  /**
   * Removes and returns the ownership of a file.
   *
   * @param path the file path
   * @return the removed file ownership, or an empty one for the path if it was not claimed
   */
  public FileOwnership take(String path) {
    FileOwnership taken = files.remove(path);
    return taken != null ? taken : new FileOwnership(path);
  }

  /**
   * Gives up every hunk overlapping the claim, so the claim can be owned elsewhere.
   *
   * @param claim the regions another owner wants
   * @return the hunks given up, as a file ownership for the claim's path
   */
  public FileOwnership release(FileOwnership claim) {
    FileOwnership released = new FileOwnership(claim.getPath());
    FileOwnership target = files.get(claim.getPath());
    if (target == null) {
      return released;
    }
    for (Hunk range : claim.getHunks()) {
      target.removeOverlapping(range).forEach(released::add);
    }
    if (target.isEmpty()) {
      files.remove(claim.getPath());
    }
    return released;
  }

  /**
   * Checks whether any claimed hunk overlaps the given file ownership.
   *
   * @param other the regions to test
   * @return true if at least one hunk intersects
   */
  public boolean intersects(FileOwnership other) {
    FileOwnership target = files.get(other.getPath());
    return target != null && other.getHunks().stream().anyMatch(target::overlaps);
  }

  /**
   * Creates an independent copy.
   *
   * @return the copy
   */
  public Ownership copy() {
    Ownership copy = new Ownership();
    files.forEach((path, f) -> copy.files.put(path, f.copy()));
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
    return files.equals(((Ownership) obj).files);
  }

  @Override
  public int hashCode() {
    return files.hashCode();
  }

  @JsonValue
  @Override
  public String toString() {
    return String.join("\n", files.values().stream().map(FileOwnership::toString).toList());
  }
}
