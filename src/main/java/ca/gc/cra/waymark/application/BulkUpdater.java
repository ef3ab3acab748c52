package ca.gc.cra.waymark.application;

import ca.gc.cra.waymark.domain.ImmutableValues;
import ca.gc.cra.waymark.domain.NamespaceNode;
import ca.gc.cra.waymark.domain.PathResolution;
import ca.gc.cra.waymark.domain.Setting;
import ca.gc.cra.waymark.domain.SettingPath;
import ca.gc.cra.waymark.domain.TreeEntry;
import ca.gc.cra.waymark.domain.errors.PathConflictException;
import ca.gc.cra.waymark.domain.errors.SettingsException;
import ca.gc.cra.waymark.domain.errors.UnknownSettingException;
import ca.gc.cra.waymark.logging.Logs;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Applies a batch of path-to-value changes to existing settings.
 * <p><strong>Why:</strong> Structured text and programmatic overrides must pass the same type, condition and
 * immutability checks as a direct {@link Setting#setValue(Object)}.</p>
 * <p><strong>Rules:</strong>
 * <ul>
 *   <li>Keys are dotted paths or nested maps mirroring the tree; both forms may be mixed.</li>
 *   <li>Nothing is created: an unknown path fails with {@link UnknownSettingException}.</li>
 *   <li>A plain value aimed at a namespace fails with {@link PathConflictException}.</li>
 *   <li>Entries apply one at a time; earlier successes stay applied when a later entry fails.</li>
 * </ul>
 * <p>Decoded sequences and mappings are frozen before validation since text formats carry no notion of
 * mutability.</p>
 * <p><strong>Thread-safety:</strong> Callers serialize concurrent updates.</p>
 *
 * @since 0.1.0
 */
public final class BulkUpdater {
  private static final Logger log = LoggerFactory.getLogger(BulkUpdater.class);

  private final NamespaceNode root;

  /**
   * Creates an updater over a tree.
   *
   * @param root namespace that update keys are relative to
   */
  public BulkUpdater(NamespaceNode root) {
    this.root = Objects.requireNonNull(root, "root");
  }

  /**
   * Applies every entry, stopping at the first failure.
   *
   * @param updates dotted or nested path to new value
   * @return number of settings updated
   * @throws SettingsException the first failure; entries applied before it remain applied
   */
  public int update(Map<?, ?> updates) {
    Objects.requireNonNull(updates, "updates");
    List<String> applied = new ArrayList<>();
    apply(root, updates, applied, null);
    return applied.size();
  }

  /**
   * Attempts every entry and reports the failures instead of throwing.
   *
   * @param updates dotted or nested path to new value
   * @return applied paths and per-path failures
   */
  public UpdateReport tryUpdate(Map<?, ?> updates) {
    Objects.requireNonNull(updates, "updates");
    List<String> applied = new ArrayList<>();
    Map<String, SettingsException> failures = new LinkedHashMap<>();
    apply(root, updates, applied, failures);
    return new UpdateReport(applied, failures);
  }

  private void apply(NamespaceNode node, Map<?, ?> updates, List<String> applied,
      Map<String, SettingsException> failures) {
    for (Map.Entry<?, ?> entry : updates.entrySet()) {
      String key = String.valueOf(entry.getKey());
      String path = node.qualify(key);
      try {
        applyEntry(node, key, path, entry.getValue(), applied, failures);
      } catch (SettingsException ex) {
        if (failures == null) {
          throw ex;
        }
        log.warn("Skipping update of {}: {}", path, ex.getMessage());
        failures.put(path, ex);
      }
    }
  }

  private void applyEntry(NamespaceNode node, String key, String path, Object value, List<String> applied,
      Map<String, SettingsException> failures) {
    if (!SettingPath.isValid(key)) {
      throw new UnknownSettingException(path);
    }
    PathResolution resolution = node.resolvePath(key, false);
    TreeEntry target = resolution.entry().orElseThrow(() -> new UnknownSettingException(path));
    if (target instanceof NamespaceNode namespace) {
      if (!(value instanceof Map<?, ?> nested)) {
        throw new PathConflictException(path, "a namespace cannot be replaced by a value");
      }
      apply(namespace, nested, applied, failures);
      return;
    }
    Setting<?> setting = (Setting<?>) target;
    setting.setValue(ImmutableValues.freeze(value));
    applied.add(path);
    log.debug("Updated {} to {}", path, Logs.preview(setting.value()));
  }
}
