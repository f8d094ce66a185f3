package org.chucc.vbranch.util;

import java.util.Objects;

/**
 * Utility for validating reference names and their components.
 * Follows the rules of {@code git check-ref-format}.
 *
 * <p>Validation rules:
 * <ul>
 *   <li>Cannot be empty, start or end with "/", or contain "//"</li>
 *   <li>No component may start with "." or end with ".lock"</li>
 *   <li>Cannot contain "..", "@{", control characters, space, or any of ~ ^ : ? * [ \</li>
 *   <li>Cannot end with "." and cannot be the single character "@"</li>
 * </ul>
 */
public final class RefnameValidator {

  /**
   * Maximum length for a reference name.
   */
  public static final int MAX_REFNAME_LENGTH = 1024;

  private static final String FORBIDDEN_CHARACTERS = " ~^:?*[\\";

  private RefnameValidator() {
    // Utility class
  }

  /**
   * Validates a reference name, which may consist of several "/"-separated components.
   *
   * @param name the name to validate
   * @param type type name for error messages ("Remote", "Branch", "Refname")
   * @throws IllegalArgumentException if validation fails
   */
  public static void validate(String name, String type) {
    Objects.requireNonNull(name, type + " name cannot be null");

    if (name.isEmpty()) {
      throw new IllegalArgumentException(type + " name cannot be empty");
    }

    if (name.length() > MAX_REFNAME_LENGTH) {
      throw new IllegalArgumentException(
          type + " name too long (max " + MAX_REFNAME_LENGTH + " characters)");
    }

    if (name.equals("@")) {
      throw new IllegalArgumentException(type + " name cannot be '@'");
    }

    if (name.startsWith("/") || name.endsWith("/")) {
      throw new IllegalArgumentException(
          type + " name cannot start or end with '/': " + name);
    }

    if (name.endsWith(".")) {
      throw new IllegalArgumentException(type + " name cannot end with '.': " + name);
    }

    if (name.contains("//")) {
      throw new IllegalArgumentException(type + " name cannot contain '//': " + name);
    }

    if (name.contains("..")) {
      throw new IllegalArgumentException(type + " name cannot contain '..': " + name);
    }

    if (name.contains("@{")) {
      throw new IllegalArgumentException(type + " name cannot contain '@{': " + name);
    }

    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (c < 0x20 || c == 0x7f || FORBIDDEN_CHARACTERS.indexOf(c) >= 0) {
        throw new IllegalArgumentException(
            type + " name contains forbidden character '" + c + "': " + name);
      }
    }

    for (String component : name.split("/")) {
      if (component.startsWith(".")) {
        throw new IllegalArgumentException(
            type + " name component cannot start with '.': " + name);
      }
      if (component.endsWith(".lock")) {
        throw new IllegalArgumentException(
            type + " name component cannot end with '.lock': " + name);
      }
    }
  }

  /**
   * Validates a single reference component (no "/" allowed), such as a remote name.
   *
   * @param name the component to validate
   * @param type type name for error messages
   * @throws IllegalArgumentException if validation fails
   */
  public static void validateComponent(String name, String type) {
    validate(name, type);
    if (name.indexOf('/') >= 0) {
      throw new IllegalArgumentException(type + " name cannot contain '/': " + name);
    }
  }
}
