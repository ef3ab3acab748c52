package ca.gc.cra.waymark.infrastructure.format;

import ca.gc.cra.waymark.application.port.SettingsCodec;
import ca.gc.cra.waymark.domain.NamespaceNode;
import ca.gc.cra.waymark.domain.Setting;
import ca.gc.cra.waymark.domain.TreeEntry;
import ca.gc.cra.waymark.domain.errors.FormatException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseError;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * <strong>What:</strong> TOML adapter for settings documents.
 * <p><strong>Decoding:</strong> tomlj parses the document; tables become nested maps and arrays become lists.
 * Integers decode as {@link Long} and are narrowed by the setting's type coercion.</p>
 * <p><strong>Encoding:</strong> Settings directly under the root come first, then one {@code [dotted.table]} section per
 * namespace that holds settings or is empty. Descriptions become trailing comments. Values without a native TOML form
 * are written as strings and converted back on load.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class TomlSettingsCodec implements SettingsCodec {
  private static final Pattern BARE_KEY = Pattern.compile("[A-Za-z0-9_-]+");

  @Override
  public Map<String, Object> decode(String text) {
    Objects.requireNonNull(text, "text");
    TomlParseResult result = Toml.parse(text);
    if (result.hasErrors()) {
      TomlParseError first = result.errors().get(0);
      throw new FormatException("Failed to parse TOML settings: " + first.toString(), first);
    }
    return asMap(result);
  }

  @Override
  public String encode(NamespaceNode root) {
    Objects.requireNonNull(root, "root");
    StringBuilder out = new StringBuilder();
    writeTable(root, "", out);
    return out.toString();
  }

  private static void writeTable(NamespaceNode node, String header, StringBuilder out) {
    Map<String, TreeEntry> entries = node.entries();
    boolean hasSettings = entries.values().stream().anyMatch(Setting.class::isInstance);
    if (!header.isEmpty() && (hasSettings || entries.isEmpty())) {
      if (out.length() > 0) {
        out.append('\n');
      }
      out.append('[').append(header).append("]\n");
    }
    for (Map.Entry<String, TreeEntry> entry : entries.entrySet()) {
      if (entry.getValue() instanceof Setting<?> setting) {
        out.append(key(entry.getKey())).append(" = ").append(render(setting.value()));
        String description = setting.description();
        if (!description.isEmpty()) {
          out.append(" # ").append(description.replaceAll("\\R", " "));
        }
        out.append('\n');
      }
    }
    for (Map.Entry<String, TreeEntry> entry : entries.entrySet()) {
      if (entry.getValue() instanceof NamespaceNode child) {
        String childHeader = header.isEmpty() ? key(entry.getKey()) : header + '.' + key(entry.getKey());
        writeTable(child, childHeader, out);
      }
    }
  }

  static String render(Object value) {
    if (value instanceof Boolean || value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte) {
      return value.toString();
    }
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (Double.isNaN(d)) {
        return "nan";
      }
      if (Double.isInfinite(d)) {
        return d > 0 ? "inf" : "-inf";
      }
      return value.toString();
    }
    if (value instanceof OffsetDateTime time) {
      return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(time);
    }
    if (value instanceof Instant instant) {
      return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(instant.atOffset(ZoneOffset.UTC));
    }
    if (value instanceof LocalDateTime time) {
      return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(time);
    }
    if (value instanceof LocalDate date) {
      return DateTimeFormatter.ISO_LOCAL_DATE.format(date);
    }
    if (value instanceof LocalTime time) {
      return DateTimeFormatter.ISO_LOCAL_TIME.format(time);
    }
    if (value instanceof Collection<?> items) {
      List<String> rendered = new ArrayList<>(items.size());
      for (Object item : items) {
        rendered.add(render(item));
      }
      return "[" + String.join(", ", rendered) + "]";
    }
    if (value instanceof Map<?, ?> map) {
      if (map.isEmpty()) {
        return "{}";
      }
      List<String> rendered = new ArrayList<>(map.size());
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        rendered.add(key(String.valueOf(entry.getKey())) + " = " + render(entry.getValue()));
      }
      return "{ " + String.join(", ", rendered) + " }";
    }
    return basicString(String.valueOf(value));
  }

  private static String key(String name) {
    return BARE_KEY.matcher(name).matches() ? name : basicString(name);
  }

  private static String basicString(String text) {
    StringBuilder quoted = new StringBuilder(text.length() + 2).append('"');
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '"' -> quoted.append("\\\"");
        case '\\' -> quoted.append("\\\\");
        case '\b' -> quoted.append("\\b");
        case '\t' -> quoted.append("\\t");
        case '\n' -> quoted.append("\\n");
        case '\f' -> quoted.append("\\f");
        case '\r' -> quoted.append("\\r");
        default -> {
          if (Character.isISOControl(c)) {
            quoted.append(String.format(Locale.ROOT, "\\u%04X", (int) c));
          } else {
            quoted.append(c);
          }
        }
      }
    }
    return quoted.append('"').toString();
  }

  private static Map<String, Object> asMap(TomlTable table) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (String key : table.keySet()) {
      map.put(key, normalize(table.get(List.of(key))));
    }
    return map;
  }

  private static Object normalize(Object value) {
    if (value instanceof TomlTable table) {
      return asMap(table);
    }
    if (value instanceof TomlArray array) {
      List<Object> list = new ArrayList<>(array.size());
      for (Object item : array.toList()) {
        list.add(normalize(item));
      }
      return list;
    }
    return value;
  }
}
