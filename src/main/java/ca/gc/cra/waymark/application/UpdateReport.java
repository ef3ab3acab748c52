package ca.gc.cra.waymark.application;

import ca.gc.cra.waymark.domain.errors.SettingsException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a lenient bulk update: the paths that were applied and the failures of the others.
 *
 * @param applied qualified paths updated successfully, in application order
 * @param failures failure per qualified path, in encounter order
 * @since 0.1.0
 */
public record UpdateReport(List<String> applied, Map<String, SettingsException> failures) {
  public UpdateReport {
    applied = List.copyOf(applied);
    failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
  }

  /**
   * Tests whether every entry was applied.
   *
   * @return {@code true} when there were no failures
   */
  public boolean isClean() {
    return failures.isEmpty();
  }
}
