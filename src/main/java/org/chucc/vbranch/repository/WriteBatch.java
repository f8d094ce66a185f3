package org.chucc.vbranch.repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered set of writes and removals that a store applies all-or-nothing.
 */
public final class WriteBatch {

  /**
   * One operation of a batch.
   *
   * @param key the key, relative to the record root
   * @param content the content to write, or null to remove the key
   */
  public record Operation(String key, Content content) {

    public Operation {
      Objects.requireNonNull(key, "Key cannot be null");
      if (key.isBlank()) {
        throw new IllegalArgumentException("Key cannot be blank");
      }
    }

    public boolean isRemoval() {
      return content == null;
    }
  }

  private final List<Operation> operations = new ArrayList<>();

  /**
   * Adds a write.
   *
   * @param key the key
   * @param content the content (must be non-null)
   * @return this batch
   */
  public WriteBatch put(String key, Content content) {
    Objects.requireNonNull(content, "Content cannot be null");
    operations.add(new Operation(key, content));
    return this;
  }

  /**
   * Adds a removal.
   *
   * @param key the key
   * @return this batch
   */
  public WriteBatch remove(String key) {
    operations.add(new Operation(key, null));
    return this;
  }

  public List<Operation> getOperations() {
    return Collections.unmodifiableList(operations);
  }
}
