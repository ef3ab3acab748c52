package ca.gc.cra.waymark.infrastructure.format;

import ca.gc.cra.waymark.application.port.SettingsCodec;
import ca.gc.cra.waymark.domain.NamespaceNode;
import ca.gc.cra.waymark.domain.Setting;
import ca.gc.cra.waymark.domain.TreeEntry;
import ca.gc.cra.waymark.domain.errors.FormatException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * <strong>What:</strong> YAML adapter for settings documents.
 * <p><strong>Decoding:</strong> SnakeYAML parses the document; the root must be a mapping. Timestamps are surfaced as
 * {@link java.time.Instant} rather than the mutable {@link Date}.</p>
 * <p><strong>Encoding:</strong> One {@code key: value} line per setting with the description as a trailing
 * comment; namespaces become indented blocks, empty namespaces {@code {}}. Sequences and mappings are written in flow
 * style.</p>
 * <p><strong>Thread-safety:</strong> Stateless; a SnakeYAML instance is created per call since it is not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class YamlSettingsCodec implements SettingsCodec {
  private static final int INDENT = 2;
  private static final Pattern PLAIN = Pattern.compile("[A-Za-z_/][A-Za-z0-9_./-]*");
  private static final Set<String> RESERVED = Set.of("true", "false", "yes", "no", "on", "off", "null", "y", "n");

  @Override
  public Map<String, Object> decode(String text) {
    Objects.requireNonNull(text, "text");
    Object document;
    try {
      document = new Yaml().load(text);
    } catch (YAMLException ex) {
      throw new FormatException("Failed to parse YAML settings: " + ex.getMessage(), ex);
    }
    if (document == null) {
      return new LinkedHashMap<>();
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new FormatException("YAML settings root must be a mapping but was "
          + document.getClass().getSimpleName());
    }
    return asMap(root);
  }

  @Override
  public String encode(NamespaceNode root) {
    Objects.requireNonNull(root, "root");
    StringBuilder out = new StringBuilder();
    writeNode(root, 0, out);
    return out.toString();
  }

  private static void writeNode(NamespaceNode node, int level, StringBuilder out) {
    String spacer = " ".repeat(INDENT * level);
    for (Map.Entry<String, TreeEntry> entry : node.entries().entrySet()) {
      String key = scalar(entry.getKey());
      if (entry.getValue() instanceof Setting<?> setting) {
        out.append(spacer).append(key).append(": ").append(render(setting.value()));
        String description = setting.description();
        if (!description.isEmpty()) {
          out.append("  # ").append(description.replaceAll("\\R", " "));
        }
        out.append('\n');
      } else {
        NamespaceNode child = (NamespaceNode) entry.getValue();
        if (child.isEmpty()) {
          out.append(spacer).append(key).append(": {}\n");
        } else {
          out.append(spacer).append(key).append(":\n");
          writeNode(child, level + 1, out);
        }
      }
    }
  }

  static String render(Object value) {
    if (value instanceof Boolean || value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte || value instanceof java.math.BigInteger) {
      return value.toString();
    }
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (Double.isNaN(d)) {
        return ".nan";
      }
      if (Double.isInfinite(d)) {
        return d > 0 ? ".inf" : "-.inf";
      }
      return value.toString();
    }
    if (value instanceof Collection<?> items) {
      List<String> rendered = new ArrayList<>(items.size());
      for (Object item : items) {
        rendered.add(render(item));
      }
      return "[" + String.join(", ", rendered) + "]";
    }
    if (value instanceof Map<?, ?> map) {
      List<String> rendered = new ArrayList<>(map.size());
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        rendered.add(scalar(String.valueOf(entry.getKey())) + ": " + render(entry.getValue()));
      }
      return "{" + String.join(", ", rendered) + "}";
    }
    return scalar(String.valueOf(value));
  }

  private static String scalar(String text) {
    if (PLAIN.matcher(text).matches() && !RESERVED.contains(text.toLowerCase(Locale.ROOT))) {
      return text;
    }
    StringBuilder quoted = new StringBuilder(text.length() + 2).append('"');
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '"' -> quoted.append("\\\"");
        case '\\' -> quoted.append("\\\\");
        case '\n' -> quoted.append("\\n");
        case '\r' -> quoted.append("\\r");
        case '\t' -> quoted.append("\\t");
        default -> {
          if (Character.isISOControl(c)) {
            quoted.append(String.format(Locale.ROOT, "\\u%04x", (int) c));
          } else {
            quoted.append(c);
          }
        }
      }
    }
    return quoted.append('"').toString();
  }

  private static Map<String, Object> asMap(Map<?, ?> raw) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      map.put(String.valueOf(entry.getKey()), normalize(entry.getValue()));
    }
    return map;
  }

  private static Object normalize(Object value) {
    if (value instanceof Date date) {
      return date.toInstant();
    }
    if (value instanceof Map<?, ?> nested) {
      return asMap(nested);
    }
    if (value instanceof List<?> items) {
      List<Object> list = new ArrayList<>(items.size());
      for (Object item : items) {
        list.add(normalize(item));
      }
      return list;
    }
    return value;
  }
}
