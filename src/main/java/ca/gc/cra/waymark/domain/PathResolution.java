package ca.gc.cra.waymark.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of walking a dotted path: the namespace that owns the final segment and the segment itself.
 *
 * @param parent namespace holding (or that would hold) the leaf
 * @param leaf final path segment
 * @since 0.1.0
 */
public record PathResolution(NamespaceNode parent, String leaf) {
  public PathResolution {
    Objects.requireNonNull(parent, "parent");
    Objects.requireNonNull(leaf, "leaf");
  }

  /**
   * Looks up the entry currently bound to the leaf.
   *
   * @return bound entry, or empty when the leaf is unbound
   */
  public Optional<TreeEntry> entry() {
    return parent.lookup(leaf);
  }

  /**
   * Returns the qualified path of the leaf.
   *
   * @return dotted path
   */
  public String path() {
    return parent.qualify(leaf);
  }
}
