package io.intellixity.docmap.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Handle of a transaction opened by {@link DocumentStore#runTransaction(java.util.function.Function)}.
 * <p>
 * docmap never opens or commits one itself; it only routes reads and writes through a handle it was given.
 */
public interface StoreTransaction {
  Optional<StoredDocument> get(String collection, String id);

  List<StoredDocument> query(StoreQuery query);

  void set(String collection, String id, Map<String, Object> fields);

  /** Fails with {@link DocumentNotFoundException} at commit or call time if the document is absent. */
  void update(String collection, String id, List<FieldUpdate> updates);

  void delete(String collection, String id);
}
