package ca.gc.cra.waymark.application;

import ca.gc.cra.waymark.application.port.SettingsDecoder;
import ca.gc.cra.waymark.application.port.SettingsEncoder;
import ca.gc.cra.waymark.domain.DeclarationLog;
import ca.gc.cra.waymark.domain.NamespaceNode;
import ca.gc.cra.waymark.domain.Setting;
import ca.gc.cra.waymark.domain.TreeEntry;
import ca.gc.cra.waymark.domain.errors.FormatException;
import ca.gc.cra.waymark.domain.errors.PathConflictException;
import ca.gc.cra.waymark.domain.errors.UnknownSettingException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Owner of the root {@link NamespaceNode} and entry point for binding, lookup, resolution,
 * bulk update and load.
 * <p><strong>Why:</strong> Settings are declared all over an application; the registry gives them one addressable
 * tree that structured text can update.</p>
 * <p><strong>Role:</strong> One process-wide instance is available through {@link #global()}; independent instances
 * can be created and injected, which is how most tests use it.</p>
 * <p><strong>Lifecycle:</strong> The root lives until {@link #reset()} discards the whole tree.</p>
 * <p><strong>Thread-safety:</strong> Reads are safe from any thread. Mutations (bind, update, load, reset) must be
 * serialized by the caller.</p>
 *
 * @since 0.1.0
 */
public final class SettingsRegistry {
  private static final Logger log = LoggerFactory.getLogger(SettingsRegistry.class);

  private volatile NamespaceNode root = NamespaceNode.createRoot();

  /**
   * Creates an independent registry with an empty tree.
   */
  public SettingsRegistry() {}

  /**
   * Returns the process-wide registry, creating it on first use.
   *
   * @return shared instance
   */
  public static SettingsRegistry global() {
    return Holder.INSTANCE;
  }

  /**
   * Returns the current root node.
   *
   * @return root namespace
   */
  public NamespaceNode root() {
    return root;
  }

  /**
   * Discards the whole tree. Settings bound before the reset become unbound; the global registry also forgets
   * recorded declaration sites.
   */
  public void reset() {
    NamespaceNode previous = root;
    root = NamespaceNode.createRoot();
    previous.clear();
    if (this == Holder.INSTANCE) {
      DeclarationLog.clear();
    }
    log.info("Settings registry reset");
  }

  /**
   * Binds a setting at {@code path}, creating intermediate namespaces.
   *
   * @param path dotted path from the root
   * @param setting setting to bind
   * @param <T> value type
   * @return {@code setting}, for field initializers
   */
  public <T> Setting<T> declare(String path, Setting<T> setting) {
    root.bind(path, setting);
    return setting;
  }

  /**
   * Binds an arbitrary value at {@code path}; only settings are accepted.
   *
   * @param path dotted path from the root
   * @param value candidate value
   * @throws ca.gc.cra.waymark.domain.errors.NotASettingException if {@code value} is not a setting
   * @throws ca.gc.cra.waymark.domain.errors.AlreadyBoundException if another setting is bound there
   * @throws PathConflictException if the path is a namespace or descends through a setting
   */
  public void bind(String path, Object value) {
    root.bind(path, value);
  }

  /**
   * Returns the namespace at {@code path}, creating it when absent.
   *
   * @param path dotted path from the root
   * @return namespace node
   */
  public NamespaceNode namespace(String path) {
    return root.namespace(path);
  }

  /**
   * Looks up an entry without creating anything.
   *
   * @param path dotted path from the root
   * @return entry, or empty when absent
   */
  public Optional<TreeEntry> lookup(String path) {
    return root.find(path);
  }

  /**
   * Returns the setting bound at {@code path}.
   *
   * @param path dotted path from the root
   * @param <T> expected value type; unchecked
   * @return bound setting
   * @throws UnknownSettingException if nothing is bound there
   * @throws PathConflictException if a namespace is bound there
   */
  @SuppressWarnings("unchecked")
  public <T> Setting<T> setting(String path) {
    TreeEntry entry = lookup(path).orElseThrow(() -> new UnknownSettingException(path));
    if (entry instanceof Setting<?> setting) {
      return (Setting<T>) setting;
    }
    throw new PathConflictException(path, "bound to a namespace, not a setting");
  }

  /**
   * Resolves the registry value of the setting at {@code path}.
   *
   * @param path dotted path from the root
   * @param <T> expected value type; unchecked
   * @return registry value
   */
  public <T> T value(String path) {
    Setting<T> setting = setting(path);
    return ValueResolver.resolve(setting);
  }

  /**
   * Applies updates fail-fast.
   *
   * @param updates dotted or nested path to new value
   * @return number of settings updated
   * @see BulkUpdater#update(Map)
   */
  public int update(Map<?, ?> updates) {
    return new BulkUpdater(root).update(updates);
  }

  /**
   * Applies updates, collecting failures.
   *
   * @param updates dotted or nested path to new value
   * @return report of applied paths and failures
   * @see BulkUpdater#tryUpdate(Map)
   */
  public UpdateReport tryUpdate(Map<?, ?> updates) {
    return new BulkUpdater(root).tryUpdate(updates);
  }

  /**
   * Decodes {@code source} and applies it fail-fast.
   *
   * @param source settings text
   * @param decoder format decoder
   * @return number of settings updated
   * @throws FormatException if the text cannot be decoded
   */
  public int load(String source, SettingsDecoder decoder) {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(decoder, "decoder");
    Map<String, Object> decoded = decoder.decode(source);
    int applied = update(decoded);
    log.debug("Loaded {} settings from {} characters of text", applied, source.length());
    return applied;
  }

  /**
   * Renders the tree as text.
   *
   * @param encoder format encoder
   * @return document text
   */
  public String encode(SettingsEncoder encoder) {
    return Objects.requireNonNull(encoder, "encoder").encode(root);
  }

  /**
   * Dumps current values as nested maps.
   *
   * @return ordered map mirroring the tree
   */
  public Map<String, Object> dump() {
    return root.values();
  }

  private static final class Holder {
    private static final SettingsRegistry INSTANCE = new SettingsRegistry();
  }
}
