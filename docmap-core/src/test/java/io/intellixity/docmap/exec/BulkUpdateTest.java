package io.intellixity.docmap.exec;

import io.intellixity.docmap.query.QuerySpec;
import io.intellixity.docmap.query.SortField;
import io.intellixity.docmap.store.FieldUpdate;
import io.intellixity.docmap.store.InMemoryDocumentStore;
import io.intellixity.docmap.store.StoreException;
import io.intellixity.docmap.store.StoreQuery;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static io.intellixity.docmap.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class BulkUpdateTest {
  private static final List<FieldUpdate> ZERO_PRICE = List.of(FieldUpdate.of("price", 0));
  private static final List<QuerySpec> PRICEY = List.of(QuerySpec.of(gt("price", 5)));

  private final InMemoryDocumentStore store = new InMemoryDocumentStore();
  private final DocumentMapper mapper = DocumentMapper.create(Session.of(store), DocmapConfig.defaults());

  private void seed(int count, double price) {
    for (int i = 0; i < count; i++) {
      Item it = new Item("item-" + i, price);
      it.rank = i;
      mapper.save(it);
    }
  }

  private long pricey() {
    return mapper.findAll(PRICEY, Item.class).size();
  }

  @Test
  void batchSizeOneOverThreeDocumentsCommitsThreePages() {
    seed(3, 10);

    long n = mapper.withUpdateBatchSize(1).update(new Item(), ZERO_PRICE, PRICEY);

    assertEquals(3, n);
    assertEquals(List.of(1, 1, 1), store.commitSizes());
    assertEquals(0, pricey());
  }

  @Test
  void commitsCeilOfMatchesOverBatchSize() {
    seed(10, 10);
    seed(4, 1);

    long n = mapper.withUpdateBatchSize(3).update(new Item(), ZERO_PRICE, PRICEY);

    assertEquals(10, n);
    assertEquals(List.of(3, 3, 3, 1), store.commitSizes());
    assertEquals(5, store.queries().stream().filter(q -> q.collection().equals("items")).count());
    assertEquals(0, pricey());
    assertEquals(4, mapper.findAll(List.of(QuerySpec.of(eq("price", 1))), Item.class).size());
  }

  @Test
  void exactMultipleStillEndsOnEmptyPage() {
    seed(4, 10);
    assertEquals(4, mapper.withUpdateBatchSize(2).update(new Item(), ZERO_PRICE, PRICEY));
    assertEquals(List.of(2, 2), store.commitSizes());
  }

  @Test
  void noMatchesMeansNoCommits() {
    seed(2, 1);
    assertEquals(0, mapper.update(new Item(), ZERO_PRICE, PRICEY));
    assertEquals(0, store.commits());
    assertEquals(1, store.queries().size());
  }

  @Test
  void pagesUseBatchLimitAndResumeAfterLastDocument() {
    seed(5, 10);
    mapper.withUpdateBatchSize(2).update(new Item(), List.of(FieldUpdate.of("name", "sold")),
        List.of(QuerySpec.of(gt("price", 5)).limit(1)));

    List<StoreQuery> qs = store.queries();
    assertEquals(4, qs.size());
    assertTrue(qs.stream().allMatch(q -> q.limit() == 2));
    assertNull(qs.get(0).startAfter());
    assertEquals("doc000002", qs.get(1).startAfter().id());
    assertEquals("doc000004", qs.get(2).startAfter().id());
    assertEquals("doc000005", qs.get(3).startAfter().id());
    assertEquals(List.of(2, 2, 1), store.commitSizes());
  }

  @Test
  void orderedQueryPagesInOrder() {
    seed(5, 10);
    long n = mapper.withUpdateBatchSize(2).update(new Item(), ZERO_PRICE,
        List.of(QuerySpec.of(gt("rank", -1)).orderBy("rank", SortField.Direction.DESC)));
    assertEquals(5, n);
    assertEquals(List.of(2, 2, 1), store.commitSizes());
    assertEquals(3, store.queries().get(1).startAfter().get("rank"));
    assertEquals(0, store.queries().get(3).startAfter().get("rank"));
  }

  @Test
  void refusedInsideTransactionBeforeAnyQuery() {
    seed(3, 10);
    int queries = store.queries().size();

    store.runTransaction(tx -> {
      DocumentMapper m = mapper.withTransaction(tx);
      MapperPreconditionException e = assertThrows(MapperPreconditionException.class,
          () -> m.update(new Item(), ZERO_PRICE, PRICEY));
      assertEquals("transactional batch updates are not supported", e.getMessage());
      return null;
    });

    assertEquals(queries, store.queries().size());
    assertEquals(0, store.commits());
    assertEquals(3, pricey());
  }

  @Test
  void refusedWhenPagingOnAnUpdatedField() {
    seed(3, 10);
    List<QuerySpec> byPrice = List.of(QuerySpec.of(gt("price", 5)).orderBy(SortField.asc("price")));
    assertThrows(MapperPreconditionException.class, () -> mapper.update(new Item(), ZERO_PRICE, byPrice));
    assertEquals(0, store.commits());
  }

  @Test
  void failedPageLeavesEarlierPagesCommitted() {
    seed(5, 10);
    store.failCommit(2);

    BulkUpdateException e = assertThrows(BulkUpdateException.class,
        () -> mapper.withUpdateBatchSize(2).update(new Item(), ZERO_PRICE, PRICEY));

    assertEquals(1, e.committedPages());
    assertEquals(2, e.committedDocuments());
    assertInstanceOf(StoreException.class, e.getCause());
    assertEquals(List.of(2), store.commitSizes());
    assertEquals(3, pricey());
  }

  @Test
  void failedQueryIsReportedWithProgress() {
    seed(5, 10);
    store.failQuery(2);

    BulkUpdateException e = assertThrows(BulkUpdateException.class,
        () -> new BulkUpdater(Session.of(store), 2).run(StoreQuery.collection("items"), ZERO_PRICE));
    assertEquals(1, e.committedPages());
    assertEquals(2, e.committedDocuments());
    assertTrue(e.getMessage().startsWith("failed to retrieve documents"), e.getMessage());
  }

  @Test
  void emptyCollectionTerminatesImmediately() {
    assertEquals(0, new BulkUpdater(Session.of(store), 1).run(StoreQuery.collection("items"), ZERO_PRICE));
    assertEquals(Collections.emptyList(), store.commitSizes());
  }
}
