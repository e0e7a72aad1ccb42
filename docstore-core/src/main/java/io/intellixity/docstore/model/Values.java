package io.intellixity.docstore.model;

import io.intellixity.docstore.exceptions.ValidationException;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Canonicalization of caller values into the document value model.
 * <p>
 * Normalized values are one of: {@code null}, {@link Boolean}, {@link Long}, {@link Double}, {@link String},
 * {@link Instant}, {@code Map<String, Object>} or {@code List<Object>}. Containers are always fresh copies.
 */
public final class Values {
  public static final String ID = "id";
  public static final String CREATED_AT = "created_at";
  public static final String UPDATED_AT = "updated_at";

  private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
  private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

  private Values() {}

  public static boolean reserved(String field) {
    return ID.equals(field) || CREATED_AT.equals(field) || UPDATED_AT.equals(field);
  }

  /** Normalize a field map (deep copy). Field names must be non-blank. */
  public static Map<String, Object> normalizeFields(Map<String, ?> fields) {
    if (fields == null) return new LinkedHashMap<>();
    Map<String, Object> out = new LinkedHashMap<>();
    for (var e : fields.entrySet()) {
      String name = e.getKey();
      if (name == null || name.isBlank()) throw new ValidationException("Field names must be non-blank");
      out.put(name, normalize(e.getValue()));
    }
    return out;
  }

  public static Object normalize(Object v) {
    if (v == null) return null;
    if (v instanceof Boolean b) return b;
    if (v instanceof Long || v instanceof Integer || v instanceof Short || v instanceof Byte) {
      return ((Number) v).longValue();
    }
    if (v instanceof Double || v instanceof Float) return ((Number) v).doubleValue();
    if (v instanceof BigInteger bi) {
      if (bi.compareTo(LONG_MIN) < 0 || bi.compareTo(LONG_MAX) > 0) {
        throw new ValidationException("Integer value out of range: " + bi);
      }
      return bi.longValue();
    }
    if (v instanceof BigDecimal bd) return bd.doubleValue();
    if (v instanceof CharSequence cs) return cs.toString();
    if (v instanceof Character c) return String.valueOf(c);
    if (v instanceof UUID u) return u.toString();
    if (v instanceof Enum<?> en) return en.name();
    if (v instanceof Instant i) return i;
    if (v instanceof Date d) return d.toInstant();
    if (v instanceof OffsetDateTime odt) return odt.toInstant();
    if (v instanceof ZonedDateTime zdt) return zdt.toInstant();
    if (v instanceof LocalDateTime ldt) return ldt.toInstant(ZoneOffset.UTC);
    if (v instanceof Map<?, ?> m) {
      Map<String, Object> out = new LinkedHashMap<>();
      for (var e : m.entrySet()) {
        if (!(e.getKey() instanceof String k)) {
          throw new ValidationException("Nested mapping keys must be strings, got: " + e.getKey());
        }
        out.put(k, normalize(e.getValue()));
      }
      return out;
    }
    if (v instanceof Collection<?> c) {
      List<Object> out = new ArrayList<>(c.size());
      for (Object x : c) out.add(normalize(x));
      return out;
    }
    if (v.getClass().isArray()) {
      int n = Array.getLength(v);
      List<Object> out = new ArrayList<>(n);
      for (int i = 0; i < n; i++) out.add(normalize(Array.get(v, i)));
      return out;
    }
    throw new ValidationException("Unsupported document value type: " + v.getClass().getName());
  }

  /** Deep copy of an already-normalized value. */
  public static Object copy(Object normalized) {
    if (normalized instanceof Map<?, ?> m) {
      Map<String, Object> out = new LinkedHashMap<>();
      for (var e : m.entrySet()) out.put(String.valueOf(e.getKey()), copy(e.getValue()));
      return out;
    }
    if (normalized instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object x : l) out.add(copy(x));
      return out;
    }
    return normalized;
  }

  public static Map<String, Object> copyFields(Map<String, Object> fields) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (var e : fields.entrySet()) out.put(e.getKey(), copy(e.getValue()));
    return out;
  }

  /** Read-only deep view suitable for handing to callers. */
  static Map<String, Object> unmodifiableFields(Map<String, Object> fields) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (var e : fields.entrySet()) out.put(e.getKey(), unmodifiable(e.getValue()));
    return Collections.unmodifiableMap(out);
  }

  private static Object unmodifiable(Object v) {
    if (v instanceof Map<?, ?> m) {
      Map<String, Object> out = new LinkedHashMap<>();
      for (var e : m.entrySet()) out.put(String.valueOf(e.getKey()), unmodifiable(e.getValue()));
      return Collections.unmodifiableMap(out);
    }
    if (v instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object x : l) out.add(unmodifiable(x));
      return Collections.unmodifiableList(out);
    }
    return v;
  }
}
