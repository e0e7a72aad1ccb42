package io.intellixity.docstore.query;

import java.util.ArrayList;
import java.util.List;

/** Ordered sort keys; the first key governs, later keys break ties. */
public final class SortSpec {
  private static final SortSpec NONE = new SortSpec(List.of());

  private final List<SortField> fields;

  private SortSpec(List<SortField> fields) {
    this.fields = List.copyOf(fields);
  }

  public static SortSpec none() { return NONE; }

  public static SortSpec of(List<SortField> fields) {
    return (fields == null || fields.isEmpty()) ? NONE : new SortSpec(fields);
  }

  public static SortSpec by(String field, int direction) {
    return none().then(field, direction);
  }

  public SortSpec then(String field, int direction) {
    List<SortField> next = new ArrayList<>(fields);
    next.add(SortField.of(field, direction));
    return new SortSpec(next);
  }

  public List<SortField> fields() { return fields; }

  public boolean isEmpty() { return fields.isEmpty(); }

  @Override
  public boolean equals(Object o) {
    return (o instanceof SortSpec s) && s.fields.equals(fields);
  }

  @Override
  public int hashCode() { return fields.hashCode(); }

  @Override
  public String toString() { return "SortSpec" + fields; }
}
