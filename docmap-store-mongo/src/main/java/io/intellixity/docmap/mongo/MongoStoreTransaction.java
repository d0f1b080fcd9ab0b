package io.intellixity.docmap.mongo;

import com.mongodb.client.ClientSession;
import io.intellixity.docmap.store.FieldUpdate;
import io.intellixity.docmap.store.StoreQuery;
import io.intellixity.docmap.store.StoreTransaction;
import io.intellixity.docmap.store.StoredDocument;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/** {@link StoreTransaction} bound to a started {@link ClientSession} transaction. */
final class MongoStoreTransaction implements StoreTransaction {
  private final MongoDocumentStore store;
  private final ClientSession session;

  MongoStoreTransaction(MongoDocumentStore store, ClientSession session) {
    this.store = store;
    this.session = session;
  }

  @Override
  public Optional<StoredDocument> get(String collection, String id) {
    return store.get(session, collection, id);
  }

  @Override
  public List<StoredDocument> query(StoreQuery query) {
    return store.query(session, query);
  }

  @Override
  public void set(String collection, String id, Map<String, Object> fields) {
    store.set(session, collection, id, fields);
  }

  @Override
  public void update(String collection, String id, List<FieldUpdate> updates) {
    store.update(session, collection, id, updates);
  }

  @Override
  public void delete(String collection, String id) {
    store.delete(session, collection, id);
  }
}
