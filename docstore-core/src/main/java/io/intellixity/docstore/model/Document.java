package io.intellixity.docstore.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A uniquely identified record of a collection.
 * <p>
 * {@code fields} never contains the reserved {@code id}/{@code created_at}/{@code updated_at} entries; those are
 * carried by the dedicated components. The field map is an immutable deep copy.
 */
public record Document(String id, Map<String, Object> fields, Instant createdAt, Instant updatedAt) {
  public Document {
    Objects.requireNonNull(id, "id");
    fields = Values.unmodifiableFields(fields == null ? Map.of() : fields);
  }

  public Object get(String field) {
    return fields.get(field);
  }

  public boolean has(String field) {
    return fields.containsKey(field);
  }
}
