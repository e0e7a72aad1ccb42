package io.intellixity.docstore.memory;

import io.intellixity.docstore.model.ValueKind;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Total ordering and equality over normalized document values.
 * <p>
 * Values of different kinds order by {@link ValueKind} rank, except integers and floats which compare numerically.
 * Null (and absent) sorts lowest.
 */
final class ValueOrdering implements Comparator<Object> {
  static final ValueOrdering INSTANCE = new ValueOrdering();

  private ValueOrdering() {}

  @Override
  public int compare(Object a, Object b) {
    ValueKind ka = ValueKind.of(a);
    ValueKind kb = ValueKind.of(b);
    if (ka.numeric() && kb.numeric()) return compareNumbers((Number) a, (Number) b);
    if (ka != kb) return Integer.compare(rank(ka), rank(kb));
    return switch (ka) {
      case NULL -> 0;
      case STRING -> ((String) a).compareTo((String) b);
      case BOOLEAN -> Boolean.compare((Boolean) a, (Boolean) b);
      case TIMESTAMP -> ((Instant) a).compareTo((Instant) b);
      default -> String.valueOf(a).compareTo(String.valueOf(b));
    };
  }

  /** Equality used by query matching: numerically equal integers and floats are equal. */
  static boolean equal(Object a, Object b) {
    if (a instanceof Number na && b instanceof Number nb) return compareNumbers(na, nb) == 0;
    if (a instanceof Map<?, ?> ma && b instanceof Map<?, ?> mb) {
      if (ma.size() != mb.size()) return false;
      for (var e : ma.entrySet()) {
        if (!mb.containsKey(e.getKey())) return false;
        if (!equal(e.getValue(), mb.get(e.getKey()))) return false;
      }
      return true;
    }
    if (a instanceof List<?> la && b instanceof List<?> lb) {
      if (la.size() != lb.size()) return false;
      for (int i = 0; i < la.size(); i++) {
        if (!equal(la.get(i), lb.get(i))) return false;
      }
      return true;
    }
    return Objects.equals(a, b);
  }

  private static int compareNumbers(Number a, Number b) {
    if (a instanceof Long la && b instanceof Long lb) return Long.compare(la, lb);
    return Double.compare(a.doubleValue(), b.doubleValue());
  }

  private static int rank(ValueKind k) {
    // integers and floats share a rank
    return (k == ValueKind.FLOAT) ? ValueKind.INTEGER.ordinal() : k.ordinal();
  }
}
