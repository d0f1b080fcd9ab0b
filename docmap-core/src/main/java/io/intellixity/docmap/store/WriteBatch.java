package io.intellixity.docmap.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered set of document updates committed atomically by {@link DocumentStore#commit(WriteBatch)}.
 * <p>
 * Not thread-safe; build it on one thread and hand it to the store.
 */
public final class WriteBatch {
  public record Write(String collection, String id, List<FieldUpdate> updates) {
    public Write {
      Objects.requireNonNull(collection, "collection");
      Objects.requireNonNull(id, "id");
      updates = List.copyOf(updates);
    }
  }

  private final List<Write> writes = new ArrayList<>();

  public WriteBatch update(String collection, String id, List<FieldUpdate> updates) {
    writes.add(new Write(collection, id, updates));
    return this;
  }

  public List<Write> writes() { return List.copyOf(writes); }
  public int size() { return writes.size(); }
  public boolean isEmpty() { return writes.isEmpty(); }
}
