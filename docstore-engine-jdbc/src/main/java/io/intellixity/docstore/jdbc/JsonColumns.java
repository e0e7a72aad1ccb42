package io.intellixity.docstore.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.docstore.model.Values;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON encoding of nested mappings and sequences stored in relational columns.
 * <p>
 * Timestamps nested inside a structure are written as ISO-8601 strings and read back as strings.
 */
public final class JsonColumns {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private JsonColumns() {}

  public static String write(Object normalized) {
    if (normalized == null) return null;
    try {
      return MAPPER.writeValueAsString(plain(normalized));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Value is not JSON-encodable: " + e.getOriginalMessage(), e);
    }
  }

  /** Decodes a stored JSON text into normalized values; null stays null. */
  public static Object read(String json) {
    if (json == null) return null;
    try {
      return Values.normalize(MAPPER.readValue(json, new TypeReference<Object>() {}));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Stored JSON column is malformed: " + e.getOriginalMessage(), e);
    }
  }

  private static Object plain(Object v) {
    if (v instanceof Instant i) return i.toString();
    if (v instanceof Map<?, ?> m) {
      Map<String, Object> out = new LinkedHashMap<>();
      for (var e : m.entrySet()) out.put(String.valueOf(e.getKey()), plain(e.getValue()));
      return out;
    }
    if (v instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object o : l) out.add(plain(o));
      return out;
    }
    return v;
  }
}
