package ca.gc.cra.framescope.application.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal JSON helper for transport-message payloads and recorded frame logs.
 * <p>Parses into plain {@link Map}/{@link List}/primitive graphs and writes compact JSON back out. Binary values are
 * rendered as a byte count, never as content.</p>
 *
 * @since 0.1.0
 */
public final class JsonSupport {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Parses a JSON document into maps, lists, and primitives.
   *
   * @param json JSON document; never {@code null}
   * @return parsed object graph; an empty map for an empty document
   * @throws IllegalArgumentException when parsing fails or trailing content follows the document
   */
  public Object parse(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        return Map.of();
      }
      Object value = readValue(parser, token);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      return value;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload", ex);
    }
  }

  /**
   * Parses a JSON document that must be an object.
   *
   * @param json JSON document
   * @return parsed object
   * @throws IllegalArgumentException when the document is not a JSON object
   */
  public Map<String, Object> parseObject(String json) {
    Object value = parse(json);
    if (!(value instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException("JSON document must be an object");
    }
    Map<String, Object> object = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      object.put(String.valueOf(entry.getKey()), entry.getValue());
    }
    return object;
  }

  /**
   * Writes a value graph as compact JSON.
   *
   * @param value map, list, string, number, boolean, {@code byte[]}, or {@code null}
   * @return compact JSON text
   */
  public String toJson(Object value) {
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = factory.createGenerator(out)) {
      writeValue(gen, value);
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to render JSON", ex);
    }
    return out.toString();
  }

  private void writeValue(JsonGenerator gen, Object value) throws IOException {
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof Map<?, ?> map) {
      gen.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        gen.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(gen, entry.getValue());
      }
      gen.writeEndObject();
    } else if (value instanceof Iterable<?> items) {
      gen.writeStartArray();
      for (Object item : items) {
        writeValue(gen, item);
      }
      gen.writeEndArray();
    } else if (value instanceof Boolean bool) {
      gen.writeBoolean(bool);
    } else if (value instanceof Integer || value instanceof Long || value instanceof Short) {
      gen.writeNumber(((Number) value).longValue());
    } else if (value instanceof Number number) {
      gen.writeNumber(number.doubleValue());
    } else if (value instanceof byte[] bytes) {
      gen.writeString("<" + bytes.length + " bytes>");
    } else {
      gen.writeString(value.toString());
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
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
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
        throw new IllegalArgumentException("Expected field name but found " + token);
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
