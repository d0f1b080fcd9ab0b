package io.intellixity.docmap.exec;

import io.intellixity.docmap.store.DocumentStore;
import io.intellixity.docmap.store.FieldUpdate;
import io.intellixity.docmap.store.StoreQuery;
import io.intellixity.docmap.store.StoreTransaction;
import io.intellixity.docmap.store.StoredDocument;
import io.intellixity.docmap.store.WriteBatch;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A document store plus, optionally, the transaction every read and write must go through.
 * <p>
 * Immutable. The transaction is an opaque handle owned by whoever called
 * {@link DocumentStore#runTransaction(java.util.function.Function)}; a session never commits or rolls it back.
 */
public final class Session implements AutoCloseable {
  private final DocumentStore store;
  private final StoreTransaction transaction;

  private Session(DocumentStore store, StoreTransaction transaction) {
    this.store = store;
    this.transaction = transaction;
  }

  public static Session of(DocumentStore store) {
    return new Session(store, null);
  }

  public static Session of(DocumentStore store, StoreTransaction transaction) {
    return new Session(store, transaction);
  }

  public void validate() {
    if (!hasStore()) throw new MapperPreconditionException("document store is required");
  }

  public boolean hasStore() { return store != null; }
  public boolean hasTransaction() { return transaction != null; }

  public DocumentStore store() { return store; }
  /** Null outside a transaction. */
  public StoreTransaction transaction() { return transaction; }

  /** Same store, bound to {@code tx}; this session is left untouched. */
  public Session withTransaction(StoreTransaction tx) {
    return new Session(store, tx);
  }

  Optional<StoredDocument> get(String collection, String id) {
    return hasTransaction() ? transaction.get(collection, id) : store.get(collection, id);
  }

  List<StoredDocument> query(StoreQuery query) {
    return hasTransaction() ? transaction.query(query) : store.query(query);
  }

  void set(String collection, String id, Map<String, Object> fields) {
    if (hasTransaction()) transaction.set(collection, id, fields);
    else store.set(collection, id, fields);
  }

  void update(String collection, String id, List<FieldUpdate> updates) {
    if (hasTransaction()) transaction.update(collection, id, updates);
    else store.update(collection, id, updates);
  }

  void delete(String collection, String id) {
    if (hasTransaction()) transaction.delete(collection, id);
    else store.delete(collection, id);
  }

  void commit(WriteBatch batch) {
    if (hasTransaction()) throw new MapperPreconditionException("transactional batch updates are not supported");
    store.commit(batch);
  }

  /** Closes the store. Call once, from the owner of the store. */
  @Override
  public void close() {
    if (store != null) store.close();
  }
}
