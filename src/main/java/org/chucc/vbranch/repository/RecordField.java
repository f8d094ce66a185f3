package org.chucc.vbranch.repository;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.chucc.vbranch.exception.BranchLoadException;
import org.chucc.vbranch.exception.StoreException;
import org.chucc.vbranch.exception.VbranchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One stored field of a record: its key, how it decodes, and what happens when it is
 * missing or unreadable.
 *
 * @param <T> the decoded type
 */
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public final class RecordField<T> {

  private static final Logger logger = LoggerFactory.getLogger(RecordField.class);

  /**
   * What a field does when it is absent or unreadable.
   */
  public enum Policy {
    /** Absent fails with NOT_FOUND, malformed fails with INVALID. */
    REQUIRED,
    /** Absent yields the default, malformed fails with INVALID. */
    DEFAULTED,
    /** Any failure at all yields the default. */
    LENIENT,
    /** Absent or non-text content yields the default, unparseable text fails with INVALID. */
    OPTIONAL_TEXT
  }

  private final String key;
  private final Policy policy;
  private final T defaultValue;
  private final Function<Content, T> decoder;

  private RecordField(String key, Policy policy, T defaultValue, Function<Content, T> decoder) {
    this.key = Objects.requireNonNull(key, "Key cannot be null");
    this.policy = Objects.requireNonNull(policy, "Policy cannot be null");
    this.defaultValue = defaultValue;
    this.decoder = Objects.requireNonNull(decoder, "Decoder cannot be null");
  }

  /**
   * Declares a mandatory field.
   *
   * @param key the key
   * @param decoder converts stored content, throwing on malformed content
   * @param <T> the decoded type
   * @return the field
   */
  public static <T> RecordField<T> required(String key, Function<Content, T> decoder) {
    return new RecordField<>(key, Policy.REQUIRED, null, decoder);
  }

  /**
   * Declares an optional field that still fails on malformed content.
   *
   * @param key the key
   * @param defaultValue the value used when the key is absent
   * @param decoder converts stored content, throwing on malformed content
   * @param <T> the decoded type
   * @return the field
   */
  public static <T> RecordField<T> defaulted(String key, T defaultValue,
                                             Function<Content, T> decoder) {
    return new RecordField<>(key, Policy.DEFAULTED, defaultValue, decoder);
  }

  /**
   * Declares a field that degrades to its default on any failure.
   *
   * @param key the key
   * @param defaultValue the value used on absence or any failure
   * @param decoder converts stored content
   * @param <T> the decoded type
   * @return the field
   */
  public static <T> RecordField<T> lenient(String key, T defaultValue,
                                           Function<Content, T> decoder) {
    return new RecordField<>(key, Policy.LENIENT, defaultValue, decoder);
  }

  /**
   * Declares an optional text field: absent or binary content is unset, text that fails
   * to parse is an error.
   *
   * @param key the key
   * @param parser parses the text, returning empty for text that means unset
   * @param <T> the decoded type
   * @return the field
   */
  public static <T> RecordField<Optional<T>> optionalText(String key,
                                                          Function<String, Optional<T>> parser) {
    return new RecordField<>(key, Policy.OPTIONAL_TEXT, Optional.empty(),
        content -> parser.apply(content.asText()));
  }

  public String getKey() {
    return key;
  }

  /**
   * Reads and decodes this field according to its policy.
   *
   * @param reader the record reader
   * @return the decoded value or the default
   * @throws BranchLoadException if the field is required and absent, or malformed
   * @throws StoreException if the store fails for a field that is not lenient
   */
  public T load(RecordReader reader) {
    Optional<Content> content;
    try {
      content = reader.read(key);
    } catch (RuntimeException e) {
      if (policy == Policy.LENIENT) {
        logger.warn("Could not read {}, using default {}: {}", key, defaultValue, e.getMessage());
        return defaultValue;
      }
      throw new StoreException(key + ": could not be read", e);
    }

    if (content.isEmpty()) {
      if (policy == Policy.REQUIRED) {
        throw BranchLoadException.notFound(key);
      }
      logger.debug("{} is absent, using default {}", key, defaultValue);
      return defaultValue;
    }

    if (policy == Policy.OPTIONAL_TEXT && content.get() instanceof Content.Binary) {
      logger.debug("{} holds binary content, treating it as unset", key);
      return defaultValue;
    }

    try {
      return decoder.apply(content.get());
    } catch (IllegalArgumentException | VbranchException e) {
      if (policy == Policy.LENIENT) {
        logger.warn("Ignoring unreadable {}, using default {}: {}",
            key, defaultValue, e.getMessage());
        return defaultValue;
      }
      throw BranchLoadException.invalid(key, e);
    }
  }

  /**
   * Adds the encoded value to a batch, or a removal when the value is unset.
   *
   * @param batch the batch
   * @param content the encoded value, or null for unset
   */
  public void store(WriteBatch batch, Content content) {
    if (content == null) {
      batch.remove(key);
    } else {
      batch.put(key, content);
    }
  }

  @Override
  public String toString() {
    return key + " (" + policy + ")";
  }
}
