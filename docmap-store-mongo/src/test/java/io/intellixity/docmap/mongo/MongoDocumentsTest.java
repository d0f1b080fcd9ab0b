package io.intellixity.docmap.mongo;

import io.intellixity.docmap.store.StoredDocument;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class MongoDocumentsTest {
  @Test
  void idMovesBetweenUnderscoreIdAndStoredDocument() {
    StoredDocument s = MongoDocuments.toStored("items", new Document("_id", "i1").append("name", "A"));
    assertEquals("i1", s.id());
    assertEquals(Map.of("name", "A"), s.fields());

    Document d = MongoDocuments.toDocument("i1", Map.of("name", "A", "_id", "ignored"));
    assertEquals(new Document("_id", "i1").append("name", "A"), d);
  }

  @Test
  void objectIdIsExposedAsHex() {
    ObjectId oid = new ObjectId();
    assertEquals(oid.toHexString(), MongoDocuments.toStored("items", new Document("_id", oid)).id());
  }

  @Test
  void hexIdsAreWrittenAsObjectIdsAndMatchedInEitherForm() {
    ObjectId oid = new ObjectId();
    String hex = oid.toHexString();

    assertEquals(oid, MongoDocuments.toDocument(hex, Map.of()).get("_id"));
    assertEquals(new Document("_id", new Document("$in", List.of(oid, hex))), MongoDocuments.byId(hex));
    assertEquals(new Document("_id", "i1"), MongoDocuments.byId("i1"));

    StoredDocument read = MongoDocuments.toStored("items", new Document("_id", oid));
    assertEquals(oid, MongoDocuments.idValue(read.id()));
  }
}
