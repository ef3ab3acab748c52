package ca.gc.cra.waymark.application.port;

import ca.gc.cra.waymark.domain.NamespaceNode;

/**
 * Port rendering a settings tree as text: one entry per setting, nested namespaces as nested mappings or tables,
 * descriptions as trailing comments where the format has comments.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SettingsEncoder {
  /**
   * Encodes the tree below {@code root}.
   *
   * @param root namespace to render
   * @return document text
   */
  String encode(NamespaceNode root);
}
