package io.intellixity.docstore.query;

import io.intellixity.docstore.model.Values;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Equality-conjunction filter: a document matches when every named field is present and equal to the expected value.
 * An empty spec matches every document.
 */
public final class QuerySpec {
  private static final QuerySpec ALL = new QuerySpec(Map.of());

  private final Map<String, Object> conditions;

  private QuerySpec(Map<String, Object> normalized) {
    this.conditions = Collections.unmodifiableMap(new LinkedHashMap<>(normalized));
  }

  public static QuerySpec all() { return ALL; }

  public static QuerySpec of(Map<String, ?> conditions) {
    if (conditions == null || conditions.isEmpty()) return ALL;
    return new QuerySpec(Values.normalizeFields(conditions));
  }

  public static QuerySpec eq(String field, Object value) {
    return all().and(field, value);
  }

  public QuerySpec and(String field, Object value) {
    Map<String, Object> next = new LinkedHashMap<>(conditions);
    next.put(field, value);
    return new QuerySpec(Values.normalizeFields(next));
  }

  /** Normalized field -> expected value, in insertion order. */
  public Map<String, Object> conditions() { return conditions; }

  public boolean isEmpty() { return conditions.isEmpty(); }

  @Override
  public boolean equals(Object o) {
    return (o instanceof QuerySpec q) && q.conditions.equals(conditions);
  }

  @Override
  public int hashCode() { return conditions.hashCode(); }

  @Override
  public String toString() { return "QuerySpec" + conditions; }
}
