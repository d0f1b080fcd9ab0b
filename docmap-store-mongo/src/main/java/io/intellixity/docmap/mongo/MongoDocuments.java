package io.intellixity.docmap.mongo;

import io.intellixity.docmap.store.StoredDocument;
import org.bson.Document;
import org.bson.types.ObjectId;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversions between Mongo {@link Document}s and {@link StoredDocument}s; the id lives in {@code _id}.
 * <p>
 * Ids that are 24-digit ObjectId hex strings are written as {@link ObjectId}s and read back as hex;
 * any other id is a string {@code _id}.
 */
final class MongoDocuments {
  private MongoDocuments() {}

  static StoredDocument toStored(String collection, Document d) {
    Object rawId = d.get(MongoQueryRenderer.ID);
    String id = (rawId instanceof ObjectId oid) ? oid.toHexString() : String.valueOf(rawId);
    Map<String, Object> fields = new LinkedHashMap<>(d);
    fields.remove(MongoQueryRenderer.ID);
    return new StoredDocument(collection, id, fields);
  }

  static Document toDocument(String id, Map<String, Object> fields) {
    Document d = new Document(MongoQueryRenderer.ID, idValue(id));
    if (fields != null) {
      for (var e : fields.entrySet()) {
        if (MongoQueryRenderer.ID.equals(e.getKey())) continue;
        d.append(e.getKey(), e.getValue());
      }
    }
    return d;
  }

  /** Matches the document whether its hex id was stored as an ObjectId or as a string. */
  static Document byId(String id) {
    if (ObjectId.isValid(id)) {
      return new Document(MongoQueryRenderer.ID, new Document("$in", List.of(new ObjectId(id), id)));
    }
    return new Document(MongoQueryRenderer.ID, id);
  }

  /** BSON value of {@code _id} for a docmap id. */
  static Object idValue(String id) {
    return ObjectId.isValid(id) ? new ObjectId(id) : id;
  }
}
