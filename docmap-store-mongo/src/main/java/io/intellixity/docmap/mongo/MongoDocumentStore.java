package io.intellixity.docmap.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.ClientSession;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.result.UpdateResult;
import io.intellixity.docmap.store.DocumentNotFoundException;
import io.intellixity.docmap.store.DocumentStore;
import io.intellixity.docmap.store.FieldUpdate;
import io.intellixity.docmap.store.StoreException;
import io.intellixity.docmap.store.StoreQuery;
import io.intellixity.docmap.store.StoreTransaction;
import io.intellixity.docmap.store.StoredDocument;
import io.intellixity.docmap.store.WriteBatch;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link DocumentStore} over the official MongoDB Java sync driver.
 * <p>
 * Ids in ObjectId hex form are stored as {@link ObjectId} {@code _id}s, others as strings (see {@link MongoDocuments}).
 * Batches and transactions run on an explicit {@link ClientSession} transaction, which needs a replica set or
 * sharded cluster. Transient transaction errors are surfaced to the caller, never retried here.
 */
public final class MongoDocumentStore implements DocumentStore {
  private static final Logger log = LoggerFactory.getLogger(MongoDocumentStore.class);

  private final MongoHandle handle;
  private final MongoClient client;
  private final MongoDatabase db;

  public MongoDocumentStore(MongoHandle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.client = handle.client();
    this.db = client.getDatabase(handle.database());
  }

  public MongoHandle handle() { return handle; }

  @Override
  public Optional<StoredDocument> get(String collection, String id) {
    return get(null, collection, id);
  }

  @Override
  public void set(String collection, String id, Map<String, Object> fields) {
    set(null, collection, id, fields);
  }

  @Override
  public void update(String collection, String id, List<FieldUpdate> updates) {
    update(null, collection, id, updates);
  }

  @Override
  public void delete(String collection, String id) {
    delete(null, collection, id);
  }

  @Override
  public String newDocumentId(String collection) {
    return new ObjectId().toHexString();
  }

  @Override
  public List<StoredDocument> query(StoreQuery query) {
    return query(null, query);
  }

  /** One explicit transaction per batch; a failed write aborts it and nothing is retried. */
  @Override
  public void commit(WriteBatch batch) {
    Objects.requireNonNull(batch, "batch");
    if (batch.isEmpty()) return;
    runTransaction(tx -> {
      for (WriteBatch.Write w : batch.writes()) {
        tx.update(w.collection(), w.id(), w.updates());
      }
      return batch.size();
    });
  }

  @Override
  public <R> R runTransaction(Function<StoreTransaction, R> body) {
    Objects.requireNonNull(body, "body");
    ClientSession s = call("begin", "*", client::startSession);
    try {
      call("start_tx", "*", () -> {
        s.startTransaction();
        return null;
      });
      R out = body.apply(new MongoStoreTransaction(this, s));
      call("commit_tx", "*", () -> {
        s.commitTransaction();
        return null;
      });
      return out;
    } catch (RuntimeException e) {
      abortQuietly(s, e);
      throw e;
    } finally {
      s.close();
    }
  }

  @Override
  public void close() {
    client.close();
  }

  // ---------- session-aware operations, shared with MongoStoreTransaction ----------

  Optional<StoredDocument> get(ClientSession s, String collection, String id) {
    return call("get", collection, () -> {
      MongoCollection<Document> col = db.getCollection(collection);
      Document d = (s == null) ? col.find(MongoDocuments.byId(id)).first() : col.find(s, MongoDocuments.byId(id)).first();
      return Optional.ofNullable(d).map(x -> MongoDocuments.toStored(collection, x));
    });
  }

  void set(ClientSession s, String collection, String id, Map<String, Object> fields) {
    call("set", collection, () -> {
      MongoCollection<Document> col = db.getCollection(collection);
      Document doc = MongoDocuments.toDocument(id, fields);
      ReplaceOptions upsert = new ReplaceOptions().upsert(true);
      return (s == null)
          ? col.replaceOne(MongoDocuments.byId(id), doc, upsert)
          : col.replaceOne(s, MongoDocuments.byId(id), doc, upsert);
    });
  }

  void update(ClientSession s, String collection, String id, List<FieldUpdate> updates) {
    UpdateResult r = call("update", collection, () -> {
      MongoCollection<Document> col = db.getCollection(collection);
      Document set = MongoQueryRenderer.set(updates);
      return (s == null) ? col.updateOne(MongoDocuments.byId(id), set) : col.updateOne(s, MongoDocuments.byId(id), set);
    });
    if (r.getMatchedCount() == 0) throw new DocumentNotFoundException(collection, id);
  }

  void delete(ClientSession s, String collection, String id) {
    call("delete", collection, () -> {
      MongoCollection<Document> col = db.getCollection(collection);
      return (s == null) ? col.deleteOne(MongoDocuments.byId(id)) : col.deleteOne(s, MongoDocuments.byId(id));
    });
  }

  List<StoredDocument> query(ClientSession s, StoreQuery q) {
    Objects.requireNonNull(q, "query");
    return call("query", q.collection(), () -> {
      MongoCollection<Document> col = db.getCollection(q.collection());
      Document filter = MongoQueryRenderer.filter(q);
      FindIterable<Document> find = (s == null) ? col.find(filter) : col.find(s, filter);
      find = find.sort(MongoQueryRenderer.sort(q.orders()));
      if (q.limit() != null) find = find.limit(q.limit());

      List<StoredDocument> out = new ArrayList<>();
      for (Document d : find) out.add(MongoDocuments.toStored(q.collection(), d));
      return out;
    });
  }

  private <R> R call(String op, String collection, Supplier<R> work) {
    long started = System.nanoTime();
    try {
      R out = work.get();
      if (log.isDebugEnabled()) {
        log.debug("docmap.mongo op={} handleId={} database={} collection={} durationMs={}",
            op, handle.id(), handle.database(), collection, (System.nanoTime() - started) / 1_000_000.0);
      }
      return out;
    } catch (MongoException e) {
      throw new StoreException("mongo op=" + op + " collection=" + collection + " failed: " + e.getMessage(), e);
    }
  }

  private static void abortQuietly(ClientSession s, RuntimeException cause) {
    if (!s.hasActiveTransaction()) return;
    try {
      s.abortTransaction();
    } catch (MongoException e) {
      cause.addSuppressed(e);
    }
  }
}
