package io.intellixity.docmap.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Narrow capability surface of a remote document store.
 * <p>
 * Implementations own connection lifecycle, retries and the wire protocol. All calls block.
 * Failures other than "document not found" surface as {@link StoreException}.
 */
public interface DocumentStore extends AutoCloseable {
  Optional<StoredDocument> get(String collection, String id);

  /** Full overwrite; creates the document if it does not exist. */
  void set(String collection, String id, Map<String, Object> fields);

  /** Applies field-path updates; {@link DocumentNotFoundException} if the document does not exist. */
  void update(String collection, String id, List<FieldUpdate> updates);

  /** Idempotent: deleting an absent document succeeds. */
  void delete(String collection, String id);

  /** Server-side generated identifier for a new document in {@code collection}. */
  String newDocumentId(String collection);

  /** Runs the query; documents come back in store order. */
  List<StoredDocument> query(StoreQuery query);

  /** Commits every write in the batch atomically. */
  void commit(WriteBatch batch);

  /** Runs {@code body} inside a store transaction and commits it when the body returns. */
  <R> R runTransaction(Function<StoreTransaction, R> body);

  @Override
  void close();
}
