package io.intellixity.docstore.mongo;

import io.intellixity.docstore.model.Values;
import io.intellixity.docstore.query.QuerySpec;
import io.intellixity.docstore.query.SortField;
import io.intellixity.docstore.query.SortSpec;
import org.bson.Document;
import org.bson.types.ObjectId;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders query and sort specs into Mongo filter/sort documents.
 * <p>
 * The logical {@code id} field maps to the native {@code _id}; a null condition matches explicit nulls only
 * ({@code $type: "null"}), never absent fields.
 */
final class MongoQueryRenderer {
  static final String NATIVE_ID = "_id";

  private MongoQueryRenderer() {}

  static Document filter(QuerySpec query) {
    Document out = new Document();
    for (var e : query.conditions().entrySet()) {
      String field = e.getKey();
      Object value = e.getValue();
      if (Values.ID.equals(field)) {
        if (value == null) {
          // every stored document has an _id
          out.append(NATIVE_ID, new Document("$exists", false));
        } else {
          mergeId(out, idFilter(String.valueOf(value)));
        }
      } else if (value == null) {
        out.append(field, new Document("$type", "null"));
      } else {
        out.append(field, MongoValues.toBson(value));
      }
    }
    return out;
  }

  /** Matches a document by id: minted ids are ObjectIds, caller-supplied ids are stored as strings. */
  static Document idFilter(String id) {
    if (ObjectId.isValid(id)) {
      return new Document("$or", List.of(
          new Document(NATIVE_ID, new ObjectId(id)),
          new Document(NATIVE_ID, id)));
    }
    return new Document(NATIVE_ID, id);
  }

  /** Sort keys in order, with {@code _id} as the final tie-breaker. */
  static Document sort(SortSpec sort) {
    Document out = new Document();
    for (SortField sf : sort.fields()) {
      String key = Values.ID.equals(sf.field()) ? NATIVE_ID : sf.field();
      if (out.containsKey(key)) continue;
      out.append(key, sf.direction() == SortField.Direction.DESC ? -1 : 1);
    }
    if (!out.containsKey(NATIVE_ID)) out.append(NATIVE_ID, 1);
    return out;
  }

  private static void mergeId(Document target, Document idFilter) {
    if (idFilter.containsKey("$or")) {
      List<Object> and = new ArrayList<>();
      and.add(idFilter);
      target.append("$and", and);
    } else {
      target.putAll(idFilter);
    }
  }
}
