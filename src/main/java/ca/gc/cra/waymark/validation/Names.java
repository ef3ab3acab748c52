package ca.gc.cra.waymark.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for setting and namespace names.
 * <p><strong>Why:</strong> Every name ends up as a path segment and as a YAML/TOML key, so it must survive a round trip
 * through dotted paths and structured text unchanged.
 * <p><strong>Role:</strong> Domain support invoked by namespace binding and path resolution.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank names and names with control characters or whitespace.</li>
 *   <li>Reject names containing the path separator.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 */
public final class Names {
  /** Separator between path segments. */
  public static final char SEPARATOR = '.';

  private Names() {
    // Utility
  }

  /**
   * Ensures a candidate name can be used as a single path segment.
   *
   * @param name candidate segment; must not be {@code null}
   * @return the unchanged name
   * @throws NullPointerException if {@code name} is {@code null}
   * @throws IllegalArgumentException if the name is blank, contains whitespace, control characters, or the separator
   */
  public static String requireSegment(String name) {
    Objects.requireNonNull(name, "name");
    if (name.isEmpty() || name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (Character.isISOControl(c)) {
        throw new IllegalArgumentException(message(name, "must not contain control characters"));
      }
      if (Character.isWhitespace(c)) {
        throw new IllegalArgumentException(message(name, "must not contain whitespace"));
      }
      if (c == SEPARATOR) {
        throw new IllegalArgumentException(message(name, "must not contain '" + SEPARATOR + "'"));
      }
    }
    return name;
  }

  private static String message(String name, String suffix) {
    return "name '" + name + "' " + suffix;
  }
}
