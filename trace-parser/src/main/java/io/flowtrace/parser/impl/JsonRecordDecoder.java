package io.flowtrace.parser.impl;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes a single line into a plain Java value tree: {@link LinkedHashMap} for objects, {@link
 * ArrayList} for arrays, {@link Long} or {@link Double} for numbers, {@link String}, {@link
 * Boolean} and {@code null}.
 *
 * <p>Parsing is strict RFC 8259: no comments, unquoted names, single quotes or trailing content.
 */
public final class JsonRecordDecoder {
  private static final TypeAdapter<JsonElement> ELEMENT_ADAPTER =
      new Gson().getAdapter(JsonElement.class);

  private JsonRecordDecoder() {}

  /**
   * Decodes a line holding exactly one JSON object.
   *
   * @throws IOException if the line is not valid JSON or its top-level value is not an object
   */
  public static Map<String, Object> decodeObject(String line) throws IOException {
    JsonElement element = readStrict(line);
    if (!element.isJsonObject()) {
      throw new IOException("Expected a JSON object but found " + describe(element));
    }
    return toMap(element.getAsJsonObject());
  }

  /**
   * Decodes an arbitrary JSON document (used for segment files and configuration).
   *
   * @throws IOException if the text is not valid JSON
   */
  public static Object decodeDocument(String text) throws IOException {
    return toJava(readStrict(text));
  }

  private static JsonElement readStrict(String text) throws IOException {
    JsonReader reader = new JsonReader(new StringReader(text));
    reader.setLenient(false);
    JsonElement element;
    try {
      element = ELEMENT_ADAPTER.read(reader);
      if (reader.peek() != JsonToken.END_DOCUMENT) {
        throw new IOException("Trailing content after JSON value at " + reader.getPath());
      }
    } catch (JsonParseException | IllegalStateException | NumberFormatException e) {
      throw new IOException(e.getMessage(), e);
    }
    return element;
  }

  private static String describe(JsonElement element) {
    if (element.isJsonArray()) return "an array";
    if (element.isJsonNull()) return "null";
    return "a scalar";
  }

  static Object toJava(JsonElement element) {
    if (element == null || element.isJsonNull()) return null;
    if (element.isJsonObject()) return toMap(element.getAsJsonObject());
    if (element.isJsonArray()) return toList(element.getAsJsonArray());
    JsonPrimitive p = element.getAsJsonPrimitive();
    if (p.isBoolean()) return p.getAsBoolean();
    if (p.isNumber()) return toNumber(p.getAsString());
    return p.getAsString();
  }

  private static Map<String, Object> toMap(JsonObject object) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (Map.Entry<String, JsonElement> e : object.entrySet()) {
      out.put(e.getKey(), toJava(e.getValue()));
    }
    return out;
  }

  private static List<Object> toList(JsonArray array) {
    List<Object> out = new ArrayList<>(array.size());
    for (JsonElement e : array) out.add(toJava(e));
    return out;
  }

  private static Number toNumber(String literal) {
    boolean integral =
        literal.indexOf('.') < 0 && literal.indexOf('e') < 0 && literal.indexOf('E') < 0;
    if (integral) {
      try {
        return Long.parseLong(literal);
      } catch (NumberFormatException e) {
        // out of long range, fall through to double
      }
    }
    return Double.parseDouble(literal);
  }
}
