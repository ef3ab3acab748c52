package ca.gc.cra.waymark.infrastructure.format;

import ca.gc.cra.waymark.application.port.SettingsCodec;
import ca.gc.cra.waymark.domain.NamespaceNode;
import ca.gc.cra.waymark.domain.Setting;
import ca.gc.cra.waymark.domain.TreeEntry;
import ca.gc.cra.waymark.domain.errors.FormatException;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON adapter for settings documents built on Jackson's streaming API.
 *
 * <p>JSON has no comments, so descriptions are not written. Non-finite floating point values are written as strings
 * ({@code "NaN"}, {@code "Infinity"}) which convert back to {@link Double} on load.</p>
 *
 * @since 0.1.0
 */
public final class JsonSettingsCodec implements SettingsCodec {
  private final JsonFactory factory = new JsonFactory();

  @Override
  public Map<String, Object> decode(String text) {
    Objects.requireNonNull(text, "text");
    try (JsonParser parser = factory.createParser(text)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        return new LinkedHashMap<>();
      }
      if (token != JsonToken.START_OBJECT) {
        throw new FormatException("JSON settings root must be an object but was " + token);
      }
      Map<String, Object> value = readObject(parser);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new FormatException("JSON settings document contains trailing content");
      }
      return value;
    } catch (JsonProcessingException ex) {
      throw new FormatException("Failed to parse JSON settings: " + ex.getOriginalMessage(), ex);
    } catch (IOException ex) {
      throw new FormatException("Failed to read JSON settings", ex);
    }
  }

  @Override
  public String encode(NamespaceNode root) {
    Objects.requireNonNull(root, "root");
    StringWriter out = new StringWriter();
    try (JsonGenerator generator = factory.createGenerator(out)) {
      generator.useDefaultPrettyPrinter();
      writeNode(root, generator);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render JSON settings", ex);
    }
    return out.append('\n').toString();
  }

  private static void writeNode(NamespaceNode node, JsonGenerator generator) throws IOException {
    generator.writeStartObject();
    for (Map.Entry<String, TreeEntry> entry : node.entries().entrySet()) {
      generator.writeFieldName(entry.getKey());
      if (entry.getValue() instanceof Setting<?> setting) {
        writeValue(setting.value(), generator);
      } else {
        writeNode((NamespaceNode) entry.getValue(), generator);
      }
    }
    generator.writeEndObject();
  }

  private static void writeValue(Object value, JsonGenerator generator) throws IOException {
    if (value instanceof Boolean bool) {
      generator.writeBoolean(bool);
    } else if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      generator.writeNumber(((Number) value).intValue());
    } else if (value instanceof Long number) {
      generator.writeNumber(number);
    } else if (value instanceof BigInteger number) {
      generator.writeNumber(number);
    } else if (value instanceof BigDecimal number) {
      generator.writeNumber(number);
    } else if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (Double.isFinite(d)) {
        generator.writeNumber(d);
      } else {
        generator.writeString(Double.toString(d));
      }
    } else if (value instanceof Collection<?> items) {
      generator.writeStartArray();
      for (Object item : items) {
        writeValue(item, generator);
      }
      generator.writeEndArray();
    } else if (value instanceof Map<?, ?> map) {
      generator.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        generator.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(entry.getValue(), generator);
      }
      generator.writeEndObject();
    } else {
      generator.writeString(String.valueOf(value));
    }
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new FormatException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new FormatException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      JsonToken valueToken = parser.nextToken();
      map.put(fieldName, readValue(parser, valueToken));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }
}
