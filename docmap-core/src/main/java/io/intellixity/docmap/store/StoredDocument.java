package io.intellixity.docmap.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One document as returned by a store: its identifier within the collection plus its fields.
 * <p>
 * Also serves as the pagination cursor for {@link StoreQuery#startAfter(StoredDocument)}.
 */
public record StoredDocument(String collection, String id, Map<String, Object> fields) {
  public StoredDocument {
    Objects.requireNonNull(collection, "collection");
    Objects.requireNonNull(id, "id");
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields == null ? Map.of() : fields));
  }

  public Object get(String field) { return fields.get(field); }
}
