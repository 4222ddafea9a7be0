package ca.gc.cra.dart.infrastructure.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal JSON helper that parses documents into {@link Map}/{@link List} structures.
 *
 * <p>Trace documents are positional and loosely typed, so they are read into a plain object graph rather than
 * bound to classes.</p>
 *
 * @since 0.1.0
 */
public final class JsonSupport {
  private static final int MAX_DEPTH = 256;

  private final JsonFactory factory = new JsonFactory();

  /**
   * Parses the supplied JSON string into a mutable object graph of maps, lists, and primitives.
   *
   * @param json JSON document; never {@code null}
   * @return parsed object graph; an empty document yields an empty map
   * @throws IllegalArgumentException when parsing fails
   */
  public Object parse(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      return readDocument(parser);
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload", ex);
    }
  }

  /**
   * Parses a JSON document from a character stream and closes the stream.
   *
   * @param reader source of the document; never {@code null}
   * @return parsed object graph; an empty document yields an empty map
   * @throws JsonParseException when the content is not valid JSON
   * @throws IOException when the reader fails
   */
  public Object parse(Reader reader) throws IOException {
    Objects.requireNonNull(reader, "reader");
    try (JsonParser parser = factory.createParser(reader)) {
      try {
        return readDocument(parser);
      } catch (IllegalArgumentException ex) {
        throw new JsonParseException(parser, ex.getMessage(), ex);
      }
    }
  }

  private Object readDocument(JsonParser parser) throws IOException {
    JsonToken first = parser.nextToken();
    if (first == null) {
      return Map.of();
    }
    Object root = readValue(parser, first, 0);
    if (parser.nextToken() != null) {
      throw new IllegalArgumentException("JSON document contains trailing content");
    }
    return root;
  }

  private Object readValue(JsonParser parser, JsonToken token, int depth) throws IOException {
    if (token == null) {
      throw new IllegalArgumentException("Unexpected end of JSON input");
    }
    if (depth > MAX_DEPTH) {
      throw new IllegalArgumentException("JSON nesting deeper than " + MAX_DEPTH + " levels");
    }
    switch (token) {
      case START_OBJECT: {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (JsonToken next = parser.nextToken(); next != JsonToken.END_OBJECT; next = parser.nextToken()) {
          if (next != JsonToken.FIELD_NAME) {
            throw new IllegalArgumentException("Expected field name but found " + next);
          }
          String name = parser.currentName();
          fields.put(name, readValue(parser, parser.nextToken(), depth + 1));
        }
        return fields;
      }
      case START_ARRAY: {
        List<Object> items = new ArrayList<>();
        for (JsonToken next = parser.nextToken(); next != JsonToken.END_ARRAY; next = parser.nextToken()) {
          items.add(readValue(parser, next, depth + 1));
        }
        return items;
      }
      case VALUE_STRING:
        return parser.getText();
      case VALUE_NUMBER_INT:
      case VALUE_NUMBER_FLOAT:
        return parser.getNumberValue();
      case VALUE_TRUE:
        return Boolean.TRUE;
      case VALUE_FALSE:
        return Boolean.FALSE;
      case VALUE_NULL:
        return null;
      default:
        throw new IllegalArgumentException("Unsupported JSON token: " + token);
    }
  }
}
