package io.intellixity.docmap.store;

import io.intellixity.docmap.query.Operator;
import io.intellixity.docmap.query.SortField;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable query against one collection.
 * <p>
 * Every refinement returns a new instance; conditions and orders accumulate, while
 * {@link #limit(int)} and {@link #startAfter(StoredDocument)} replace any previous value.
 */
public final class StoreQuery {
  private final String collection;
  private final List<Condition> conditions;
  private final List<SortField> orders;
  private final Integer limit;
  private final StoredDocument startAfter;

  private StoreQuery(String collection, List<Condition> conditions, List<SortField> orders,
                     Integer limit, StoredDocument startAfter) {
    this.collection = collection;
    this.conditions = List.copyOf(conditions);
    this.orders = List.copyOf(orders);
    this.limit = limit;
    this.startAfter = startAfter;
  }

  /** Unfiltered, unordered, unlimited query over {@code collection}. */
  public static StoreQuery collection(String collection) {
    Objects.requireNonNull(collection, "collection");
    if (collection.isBlank()) throw new IllegalArgumentException("collection is required");
    return new StoreQuery(collection, List.of(), List.of(), null, null);
  }

  public String collection() { return collection; }
  public List<Condition> conditions() { return conditions; }
  public List<SortField> orders() { return orders; }
  /** Null when no limit applies. */
  public Integer limit() { return limit; }
  /** Null on the first page. */
  public StoredDocument startAfter() { return startAfter; }

  public StoreQuery where(String field, Operator operator, Object value) {
    List<Condition> next = new ArrayList<>(conditions);
    next.add(new Condition(field, operator, value));
    return new StoreQuery(collection, next, orders, limit, startAfter);
  }

  public StoreQuery orderBy(SortField order) {
    Objects.requireNonNull(order, "order");
    List<SortField> next = new ArrayList<>(orders);
    next.add(order);
    return new StoreQuery(collection, conditions, next, limit, startAfter);
  }

  public StoreQuery limit(int limit) {
    if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
    return new StoreQuery(collection, conditions, orders, limit, startAfter);
  }

  public StoreQuery startAfter(StoredDocument cursor) {
    Objects.requireNonNull(cursor, "cursor");
    if (!collection.equals(cursor.collection())) {
      throw new IllegalArgumentException("cursor belongs to collection '" + cursor.collection()
          + "', query targets '" + collection + "'");
    }
    return new StoreQuery(collection, conditions, orders, limit, cursor);
  }

  @Override
  public String toString() {
    return "StoreQuery{collection=" + collection + ", conditions=" + conditions.size()
        + ", orders=" + orders + ", limit=" + limit + ", startAfter="
        + (startAfter == null ? "null" : startAfter.id()) + "}";
  }
}
