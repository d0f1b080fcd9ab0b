package io.intellixity.docmap.exec;

import io.intellixity.docmap.query.PredicateBuilder;
import io.intellixity.docmap.query.QuerySpec;
import io.intellixity.docmap.query.SortField;
import io.intellixity.docmap.record.CollectionNames;
import io.intellixity.docmap.record.FieldMappingException;
import io.intellixity.docmap.record.RecordAdapter;
import io.intellixity.docmap.record.RecordAdapters;
import io.intellixity.docmap.store.DocumentNotFoundException;
import io.intellixity.docmap.store.FieldUpdate;
import io.intellixity.docmap.store.StoreQuery;
import io.intellixity.docmap.store.StoreTransaction;
import io.intellixity.docmap.store.StoredDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps records to documents of one store and runs CRUD and query operations for them.
 * <p>
 * Instances are immutable snapshots: {@link #model(Class)}, {@link #withSession(Session)},
 * {@link #withTransaction(StoreTransaction)} and {@link #withUpdateBatchSize(int)} return new mappers,
 * so callers sharing a base mapper never see each other's bindings.
 * <p>
 * Operations taking a record bind the model from that record's class. Reads and writes go through the
 * session's transaction when it has one. Every call blocks for its store round-trips; nothing is retried.
 */
public final class DocumentMapper {
  private static final Logger log = LoggerFactory.getLogger(DocumentMapper.class);

  private final Session session;
  private final RecordAdapter<?> model;
  private final int updateBatchSize;

  private DocumentMapper(Session session, RecordAdapter<?> model, int updateBatchSize) {
    this.session = Objects.requireNonNull(session, "session");
    this.model = model;
    this.updateBatchSize = updateBatchSize;
  }

  public static DocumentMapper create(Session session) {
    return create(session, DocmapConfig.load());
  }

  public static DocumentMapper create(Session session, DocmapConfig config) {
    Objects.requireNonNull(config, "config");
    return new DocumentMapper(session, null, config.updateBatchSize());
  }

  // ---------- binding (each returns a new mapper) ----------

  public DocumentMapper model(Class<?> type) {
    Objects.requireNonNull(type, "type");
    return new DocumentMapper(session, RecordAdapters.of(type), updateBatchSize);
  }

  public DocumentMapper withSession(Session session) {
    return new DocumentMapper(session, model, updateBatchSize);
  }

  public DocumentMapper withTransaction(StoreTransaction tx) {
    return new DocumentMapper(session.withTransaction(tx), model, updateBatchSize);
  }

  public DocumentMapper withUpdateBatchSize(int size) {
    return new DocumentMapper(session, model, DocmapConfig.checkBatchSize(size));
  }

  // ---------- accessors ----------

  public Session session() { return session; }
  public int updateBatchSize() { return updateBatchSize; }

  /** Bound model type, or null. */
  public Class<?> modelType() { return model == null ? null : model.type(); }

  public String collectionName() {
    if (model == null) throw noModel();
    return CollectionNames.resolve(model, null);
  }

  /** Identifier of {@code record}, or {@code ""}. */
  public String idOf(Object record) {
    if (record == null) return "";
    return RecordAdapters.forRecord(record).extractId(record);
  }

  public StoreQuery applyQueries(StoreQuery query, List<QuerySpec> specs) {
    return PredicateBuilder.apply(query, specs);
  }

  // ---------- operations ----------

  /** Loads the document identified by {@code record}'s id into {@code record}. */
  public <T> T getById(T record) {
    Bound<T> b = bind(record);
    String id = b.adapter.extractId(record);
    if (id.isEmpty()) throw new MapperPreconditionException("ID cannot be empty");

    log.debug("docmap op=get_by_id collection={} id={} tx={}", b.collection, id, session.hasTransaction());
    StoredDocument doc = session.get(b.collection, id)
        .orElseThrow(() -> new DocumentNotFoundException(b.collection, id));
    return b.adapter.decode(doc, record);
  }

  /** Loads the first document matching {@code specs} into {@code destination}; at most one document is read. */
  public <T> T findOne(List<QuerySpec> specs, T destination) {
    Bound<T> b = bind(destination);
    StoreQuery q = PredicateBuilder.apply(StoreQuery.collection(b.collection), specs).limit(1);

    log.debug("docmap op=find_one collection={} tx={}", b.collection, session.hasTransaction());
    List<StoredDocument> docs = session.query(q);
    if (docs.isEmpty()) throw new DocumentNotFoundException(b.collection, null);
    return b.adapter.decode(docs.get(0), destination);
  }

  /**
   * Every document matching {@code specs} (the whole collection when {@code specs} is null or empty),
   * decoded into fresh {@code type} instances in store order.
   */
  public <T> List<T> findAll(List<QuerySpec> specs, Class<T> type) {
    Objects.requireNonNull(type, "type");
    session.validate();
    RecordAdapter<T> adapter = RecordAdapters.of(type);
    String collection = CollectionNames.resolve(adapter, null);
    StoreQuery q = PredicateBuilder.apply(StoreQuery.collection(collection), specs);

    List<StoredDocument> docs = session.query(q);
    List<T> out = new ArrayList<>(docs.size());
    for (StoredDocument d : docs) {
      out.add(adapter.decode(d));
    }
    log.debug("docmap op=find_all collection={} tx={} count={}", collection, session.hasTransaction(), out.size());
    return out;
  }

  /**
   * Without {@code fieldsToSave}: writes the whole record, generating and injecting an id first when it has none.
   * With {@code fieldsToSave}: updates only those document fields of an existing document.
   */
  public <T> void save(T record, String... fieldsToSave) {
    Bound<T> b = bind(record);
    String id = b.adapter.extractId(record);
    Map<String, Object> data = b.adapter.toFieldMapping(record);

    if (fieldsToSave == null || fieldsToSave.length == 0) {
      String mode = "overwrite";
      if (id.isEmpty()) {
        id = session.store().newDocumentId(b.collection);
        b.adapter.injectId(record, id);
        mode = "create";
      }
      log.debug("docmap op=save collection={} id={} mode={} tx={}", b.collection, id, mode, session.hasTransaction());
      session.set(b.collection, id, data);
      return;
    }

    if (id.isEmpty()) throw new MapperPreconditionException("cannot update fields on a record with no ID");

    List<FieldUpdate> updates = new ArrayList<>(fieldsToSave.length);
    for (String field : fieldsToSave) {
      if (!data.containsKey(field)) {
        throw new FieldMappingException(b.adapter.type(), field, "field " + field + " not found in model data");
      }
      updates.add(new FieldUpdate(field, data.get(field)));
    }
    log.debug("docmap op=save collection={} id={} mode=fields fields={} tx={}",
        b.collection, id, updates.size(), session.hasTransaction());
    session.update(b.collection, id, updates);
  }

  /** Updates the document identified by {@code record}'s id. */
  public <T> long update(T record, List<FieldUpdate> updates) {
    return update(record, updates, null);
  }

  /**
   * Applies {@code updates} to the document identified by {@code record}'s id or, when the record has no id,
   * to every document matching {@code where}.
   * <p>
   * The by-query form pages through matches in batches of {@link #updateBatchSize()}; each batch is atomic,
   * the whole run is not (see {@link BulkUpdateException}). It is refused inside a transaction and when an
   * order-by field of {@code where} is one of the updated paths, since paging on a field being rewritten
   * can skip or repeat documents.
   *
   * @return number of documents updated
   */
  public <T> long update(T record, List<FieldUpdate> updates, List<QuerySpec> where) {
    Bound<T> b = bind(record);
    if (updates == null || updates.isEmpty()) throw new IllegalArgumentException("updates are required");

    String id = b.adapter.extractId(record);
    if (!id.isEmpty()) {
      log.debug("docmap op=update collection={} id={} mode=id tx={}", b.collection, id, session.hasTransaction());
      session.update(b.collection, id, updates);
      return 1;
    }

    if (where == null || where.stream().noneMatch(s -> s != null && !s.isEmpty())) {
      throw new MapperPreconditionException("either ID or query conditions must be provided");
    }
    if (session.hasTransaction()) {
      throw new MapperPreconditionException("transactional batch updates are not supported");
    }
    checkOrderDisjoint(where, updates);

    StoreQuery q = PredicateBuilder.apply(StoreQuery.collection(b.collection), where);
    log.debug("docmap op=update collection={} mode=query batchSize={}", b.collection, updateBatchSize);
    return new BulkUpdater(session, updateBatchSize).run(q, updates);
  }

  /** Deletes the document identified by {@code record}'s id; absent documents are not an error. */
  public <T> void delete(T record) {
    Bound<T> b = bind(record);
    String id = b.adapter.extractId(record);
    if (id.isEmpty()) throw new MapperPreconditionException("ID cannot be empty for delete");

    log.debug("docmap op=delete collection={} id={} tx={}", b.collection, id, session.hasTransaction());
    session.delete(b.collection, id);
  }

  // ---------- internals ----------

  private record Bound<T>(RecordAdapter<T> adapter, String collection) {}

  private <T> Bound<T> bind(T record) {
    if (record == null) throw noModel();
    session.validate();
    RecordAdapter<T> adapter = RecordAdapters.forRecord(record);
    return new Bound<>(adapter, CollectionNames.resolve(adapter, record));
  }

  private static void checkOrderDisjoint(List<QuerySpec> where, List<FieldUpdate> updates) {
    Set<String> paths = new LinkedHashSet<>();
    for (FieldUpdate u : updates) paths.add(u.path());
    for (QuerySpec spec : where) {
      if (spec == null) continue;
      for (SortField o : spec.orders()) {
        if (paths.contains(o.field())) {
          throw new MapperPreconditionException("cannot page on order-by field '" + o.field()
              + "' while updating it; order by a field that is not updated");
        }
      }
    }
  }

  private static MapperPreconditionException noModel() {
    return new MapperPreconditionException("no model set, call model(Type.class) or pass a record");
  }
}
