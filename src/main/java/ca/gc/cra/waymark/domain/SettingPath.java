package ca.gc.cra.waymark.domain;

import ca.gc.cra.waymark.validation.Names;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits and joins dotted setting paths such as {@code "server.http.port"}.
 *
 * @since 0.1.0
 */
public final class SettingPath {
  private SettingPath() {}

  /**
   * Splits a dotted path into validated segments.
   *
   * @param dotted path; must contain at least one segment
   * @return immutable list of segments
   * @throws IllegalArgumentException when a segment is blank or otherwise invalid
   */
  public static List<String> split(String dotted) {
    Objects.requireNonNull(dotted, "path");
    List<String> segments = new ArrayList<>();
    int start = 0;
    for (int i = 0; i <= dotted.length(); i++) {
      if (i == dotted.length() || dotted.charAt(i) == Names.SEPARATOR) {
        segments.add(Names.requireSegment(dotted.substring(start, i)));
        start = i + 1;
      }
    }
    return List.copyOf(segments);
  }

  /**
   * Tests whether {@code dotted} is a well-formed path.
   *
   * @param dotted candidate path
   * @return {@code true} when {@link #split(String)} would succeed
   */
  public static boolean isValid(String dotted) {
    if (dotted == null) {
      return false;
    }
    try {
      split(dotted);
      return true;
    } catch (IllegalArgumentException ex) {
      return false;
    }
  }

  /**
   * Appends a child name to a parent path.
   *
   * @param parent parent path; empty for the root
   * @param child child segment or dotted suffix
   * @return joined path
   */
  public static String join(String parent, String child) {
    return parent == null || parent.isEmpty() ? child : parent + Names.SEPARATOR + child;
  }
}
