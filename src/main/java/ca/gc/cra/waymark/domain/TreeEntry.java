package ca.gc.cra.waymark.domain;

import java.util.Optional;

/**
 * Value bound to a name inside a {@link NamespaceNode}: either a child namespace or a {@link Setting}.
 *
 * @since 0.1.0
 */
public sealed interface TreeEntry permits NamespaceNode, Setting {
  /**
   * Returns the namespace holding this entry.
   *
   * @return parent node; empty for the root and for settings not yet bound
   */
  Optional<NamespaceNode> parent();

  /**
   * Returns the dotted path of this entry from the root.
   *
   * @return qualified path; empty string for the root and for unbound settings
   */
  String path();
}
