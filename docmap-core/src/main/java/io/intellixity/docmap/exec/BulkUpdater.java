package io.intellixity.docmap.exec;

import io.intellixity.docmap.store.FieldUpdate;
import io.intellixity.docmap.store.StoreQuery;
import io.intellixity.docmap.store.StoredDocument;
import io.intellixity.docmap.store.WriteBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Applies the same field updates to every document a query matches, one page of {@code batchSize}
 * documents per atomic batch, resuming each page strictly after the last document of the previous one.
 * <p>
 * Terminates after {@code ceil(N / batchSize)} commits for N matching documents, provided the store keeps
 * a stable order across pages. A failed page aborts the run; earlier pages stay committed.
 */
final class BulkUpdater {
  private static final Logger log = LoggerFactory.getLogger(BulkUpdater.class);

  private final Session session;
  private final int batchSize;

  BulkUpdater(Session session, int batchSize) {
    this.session = session;
    this.batchSize = batchSize;
  }

  /** Returns the number of documents updated. */
  long run(StoreQuery query, List<FieldUpdate> updates) {
    StoredDocument cursor = null;
    long pages = 0;
    long documents = 0;
    long started = System.nanoTime();

    while (true) {
      StoreQuery page = query.limit(batchSize);
      if (cursor != null) page = page.startAfter(cursor);

      List<StoredDocument> docs;
      try {
        docs = session.query(page);
      } catch (RuntimeException e) {
        throw new BulkUpdateException("failed to retrieve documents", pages, documents, e);
      }
      if (docs.isEmpty()) break;

      WriteBatch batch = new WriteBatch();
      for (StoredDocument d : docs) {
        batch.update(d.collection(), d.id(), updates);
      }

      try {
        session.commit(batch);
      } catch (RuntimeException e) {
        log.warn("docmap op=bulk_update collection={} page={} size={} committedPages={} committedDocuments={} status=failed",
            query.collection(), pages + 1, docs.size(), pages, documents);
        throw new BulkUpdateException("batch commit failed", pages, documents, e);
      }

      pages++;
      documents += docs.size();
      cursor = docs.get(docs.size() - 1);
      log.debug("docmap op=bulk_update collection={} page={} size={} lastId={}",
          query.collection(), pages, docs.size(), cursor.id());
    }

    if (log.isDebugEnabled()) {
      log.debug("docmap op=bulk_update_done collection={} pages={} documents={} durationMs={}",
          query.collection(), pages, documents, (System.nanoTime() - started) / 1_000_000.0);
    }
    return documents;
  }
}
