package io.intellixity.docstore.mongo;

import io.intellixity.docstore.model.Values;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Conversion between normalized document values and BSON-encodable driver values. */
final class MongoValues {
  private MongoValues() {}

  /** Normalized value to a driver value: timestamps become {@link Date}, mappings become {@link Document}. */
  static Object toBson(Object v) {
    if (v instanceof Instant i) return Date.from(i);
    if (v instanceof Map<?, ?> m) {
      Document out = new Document();
      for (var e : m.entrySet()) out.append(String.valueOf(e.getKey()), toBson(e.getValue()));
      return out;
    }
    if (v instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object o : l) out.add(toBson(o));
      return out;
    }
    return v;
  }

  /** Driver value read from a stored document back to a normalized value. */
  static Object fromBson(Object v) {
    return Values.normalize(plain(v));
  }

  static String idString(Object id) {
    if (id == null) return null;
    if (id instanceof ObjectId oid) return oid.toHexString();
    return String.valueOf(plain(id));
  }

  static Instant instant(Object v) {
    if (v instanceof Date d) return d.toInstant();
    if (v instanceof Instant i) return i;
    return null;
  }

  private static Object plain(Object v) {
    if (v == null || v instanceof String || v instanceof Boolean || v instanceof Number && !(v instanceof Decimal128)) {
      return v;
    }
    if (v instanceof Decimal128 d) return d.bigDecimalValue();
    if (v instanceof Date d) return d.toInstant();
    if (v instanceof ObjectId oid) return oid.toHexString();
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
    // other BSON types (binary, regex, code) surface as their string form
    return String.valueOf(v);
  }
}
