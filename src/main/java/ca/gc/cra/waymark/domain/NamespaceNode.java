package ca.gc.cra.waymark.domain;

import ca.gc.cra.waymark.domain.errors.AlreadyBoundException;
import ca.gc.cra.waymark.domain.errors.NotASettingException;
import ca.gc.cra.waymark.domain.errors.PathConflictException;
import ca.gc.cra.waymark.domain.errors.UnknownSettingException;
import ca.gc.cra.waymark.validation.Names;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Node of the settings tree mapping names to child namespaces or {@link Setting}s.
 * <p><strong>Why:</strong> Lets independent modules declare settings under their own prefixes while one root collects
 * them into a single addressable tree.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create child namespaces lazily, exactly once per name, so repeated access returns the same node.</li>
 *   <li>Refuse to rebind a name that holds a setting, to bind non-settings, and to mix namespaces with settings.</li>
 *   <li>Resolve dotted paths without creating anything when asked to.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Entry access is synchronized on the node, so lazy creation from concurrent readers
 * cannot corrupt the tree. Callers still serialize logical updates.</p>
 *
 * @since 0.1.0
 */
public final class NamespaceNode implements TreeEntry {
  private static final Logger log = LoggerFactory.getLogger(NamespaceNode.class);

  private final NamespaceNode parent;
  private final String name;
  private final Map<String, TreeEntry> entries = new LinkedHashMap<>();

  private NamespaceNode(NamespaceNode parent, String name) {
    this.parent = parent;
    this.name = name;
  }

  /**
   * Creates a detached root node.
   *
   * @return empty root
   */
  public static NamespaceNode createRoot() {
    return new NamespaceNode(null, "");
  }

  /**
   * Returns this node's name within its parent.
   *
   * @return name; empty string for the root
   */
  public String name() {
    return name;
  }

  @Override
  public Optional<NamespaceNode> parent() {
    return Optional.ofNullable(parent);
  }

  @Override
  public String path() {
    return parent == null ? "" : parent.qualify(name);
  }

  public boolean isRoot() {
    return parent == null;
  }

  /**
   * Qualifies a child name with this node's path.
   *
   * @param child child name or dotted suffix
   * @return dotted path from the root
   */
  public String qualify(String child) {
    return SettingPath.join(path(), child);
  }

  /**
   * Looks up a direct child.
   *
   * @param childName single path segment
   * @return bound entry, or empty when nothing is bound
   */
  public synchronized Optional<TreeEntry> lookup(String childName) {
    return Optional.ofNullable(entries.get(childName));
  }

  /**
   * Looks up an entry by dotted path without creating intermediate namespaces.
   *
   * @param dottedPath path relative to this node
   * @return bound entry; empty when any segment is missing or descends through a setting
   */
  public Optional<TreeEntry> find(String dottedPath) {
    if (!SettingPath.isValid(dottedPath)) {
      return Optional.empty();
    }
    TreeEntry current = this;
    for (String segment : SettingPath.split(dottedPath)) {
      if (!(current instanceof NamespaceNode node)) {
        return Optional.empty();
      }
      Optional<TreeEntry> next = node.lookup(segment);
      if (next.isEmpty()) {
        return Optional.empty();
      }
      current = next.get();
    }
    return Optional.of(current);
  }

  /**
   * Returns the namespace at {@code dottedPath}, creating missing namespaces along the way.
   *
   * @param dottedPath path relative to this node
   * @return existing or newly created namespace; the same instance on every call
   * @throws PathConflictException if a segment is bound to a setting
   */
  public NamespaceNode namespace(String dottedPath) {
    NamespaceNode current = this;
    for (String segment : SettingPath.split(dottedPath)) {
      current = current.child(segment);
    }
    return current;
  }

  /**
   * Walks {@code dottedPath} down to the parent of its final segment.
   *
   * @param dottedPath path relative to this node
   * @param createMissing whether absent intermediate namespaces are created
   * @return parent node and leaf name
   * @throws PathConflictException if an intermediate segment is bound to a setting
   * @throws UnknownSettingException if {@code createMissing} is {@code false} and an intermediate segment is absent
   */
  public PathResolution resolvePath(String dottedPath, boolean createMissing) {
    List<String> segments = SettingPath.split(dottedPath);
    NamespaceNode current = this;
    for (String segment : segments.subList(0, segments.size() - 1)) {
      if (createMissing) {
        current = current.child(segment);
        continue;
      }
      TreeEntry next = current.lookup(segment)
          .orElseThrow(() -> new UnknownSettingException(qualify(dottedPath)));
      if (next instanceof Setting<?>) {
        throw new PathConflictException(current.qualify(segment), "cannot descend through a setting");
      }
      current = (NamespaceNode) next;
    }
    return new PathResolution(current, segments.get(segments.size() - 1));
  }

  /**
   * Binds a setting at {@code dottedPath}, creating intermediate namespaces.
   *
   * @param dottedPath path relative to this node
   * @param value the setting to bind
   * @throws NotASettingException if {@code value} is not a {@link Setting}
   * @throws AlreadyBoundException if a different setting is already bound there
   * @throws PathConflictException if the path holds a namespace or descends through a setting
   */
  public void bind(String dottedPath, Object value) {
    if (!(value instanceof Setting<?> setting)) {
      throw new NotASettingException(qualify(dottedPath), value);
    }
    PathResolution resolution = resolvePath(dottedPath, true);
    resolution.parent().bindLocal(resolution.leaf(), setting);
  }

  /**
   * Binds {@code replacement} at {@code dottedPath} on behalf of a class-level declaration.
   *
   * <p>An unbound path is bound normally. A path already holding a setting is rebound only when the replacement was
   * constructed by a class of the same name loaded by another class loader, which is what reloading a module does.
   * Any other existing setting, including a second declaration from the same loaded class, still raises
   * {@link AlreadyBoundException}.</p>
   *
   * @param dottedPath path relative to this node
   * @param replacement setting declared by the class
   * @throws AlreadyBoundException if the existing setting was declared elsewhere
   * @throws PathConflictException if the path holds a namespace or descends through a setting
   */
  public void redeclare(String dottedPath, Setting<?> replacement) {
    Objects.requireNonNull(replacement, "replacement");
    PathResolution resolution = resolvePath(dottedPath, true);
    NamespaceNode owner = resolution.parent();
    String leaf = resolution.leaf();
    synchronized (owner) {
      TreeEntry existing = owner.entries.get(leaf);
      if (existing instanceof Setting<?> previous && previous != replacement
          && replacement.isReloadOf(previous)) {
        previous.detach();
        owner.entries.remove(leaf);
        log.debug("Reloaded class redeclares setting {}", owner.qualify(leaf));
      }
      owner.bindLocal(leaf, replacement);
    }
  }

  /**
   * Removes every entry from this node. Settings anywhere below it become unbound.
   */
  public synchronized void clear() {
    for (TreeEntry entry : entries.values()) {
      if (entry instanceof Setting<?> setting) {
        setting.detach();
      } else {
        ((NamespaceNode) entry).clear();
      }
    }
    entries.clear();
  }

  public synchronized int size() {
    return entries.size();
  }

  public synchronized boolean isEmpty() {
    return entries.isEmpty();
  }

  public synchronized boolean contains(String childName) {
    return entries.containsKey(childName);
  }

  /**
   * Returns a snapshot of the direct children in insertion order.
   *
   * @return unmodifiable ordered map
   */
  public synchronized Map<String, TreeEntry> entries() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
  }

  /**
   * Returns every setting below this node keyed by path relative to this node, depth first in insertion order.
   *
   * @return unmodifiable ordered map
   */
  public Map<String, Setting<?>> settings() {
    Map<String, Setting<?>> result = new LinkedHashMap<>();
    collectSettings("", result);
    return Collections.unmodifiableMap(result);
  }

  /**
   * Dumps the tree below this node as nested maps of current values.
   *
   * @return mutable ordered map mirroring the tree
   */
  public Map<String, Object> values() {
    Map<String, Object> result = new LinkedHashMap<>();
    entries().forEach((childName, entry) -> {
      if (entry instanceof NamespaceNode node) {
        result.put(childName, node.values());
      } else {
        result.put(childName, ((Setting<?>) entry).value());
      }
    });
    return result;
  }

  private void collectSettings(String prefix, Map<String, Setting<?>> target) {
    entries().forEach((childName, entry) -> {
      String relative = SettingPath.join(prefix, childName);
      if (entry instanceof NamespaceNode node) {
        node.collectSettings(relative, target);
      } else {
        target.put(relative, (Setting<?>) entry);
      }
    });
  }

  private synchronized NamespaceNode child(String childName) {
    TreeEntry existing = entries.get(childName);
    if (existing instanceof NamespaceNode node) {
      return node;
    }
    if (existing != null) {
      throw new PathConflictException(qualify(childName), "bound to a setting, not a namespace");
    }
    NamespaceNode created = new NamespaceNode(this, Names.requireSegment(childName));
    entries.put(childName, created);
    return created;
  }

  private synchronized void bindLocal(String leaf, Setting<?> setting) {
    TreeEntry existing = entries.get(leaf);
    if (existing == setting) {
      return;
    }
    if (existing instanceof NamespaceNode) {
      throw new PathConflictException(qualify(leaf), "bound to a namespace, not a setting");
    }
    if (existing != null) {
      throw new AlreadyBoundException(qualify(leaf));
    }
    setting.attach(this, leaf);
    entries.put(leaf, setting);
    log.debug("Bound setting {} with default {}", qualify(leaf), setting.defaultValue());
  }

  @Override
  public String toString() {
    return "NamespaceNode(" + (isRoot() ? "<root>" : path()) + ", " + size() + " entries)";
  }
}
