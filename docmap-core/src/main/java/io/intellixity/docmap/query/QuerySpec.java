package io.intellixity.docmap.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Declarative filter / order / limit clauses for one query.
 * <p>
 * Immutable: every {@code where}, {@code orderBy} and {@code limit} call returns a new spec.
 * Several specs applied to the same query compose in order (see {@link PredicateBuilder}).
 */
@JsonSerialize(using = QuerySpecJsonSerializer.class)
@JsonDeserialize(using = QuerySpecJsonDeserializer.class)
public final class QuerySpec {
  /** Limit sentinel: no limit is applied. */
  public static final int LIMIT_UNLIMITED = -1;
  /** Largest page a caller should ask a store for in one query. */
  public static final int LIMIT_MAX = 10_000;

  private static final QuerySpec EMPTY = new QuerySpec(List.of(), List.of(), LIMIT_UNLIMITED);

  private final List<Filter> filters;
  private final List<SortField> orders;
  private final int limit;

  private QuerySpec(List<Filter> filters, List<SortField> orders, int limit) {
    this.filters = List.copyOf(filters);
    this.orders = List.copyOf(orders);
    this.limit = limit;
  }

  public static QuerySpec create() { return EMPTY; }

  public static QuerySpec of(Filter... filters) {
    return new QuerySpec(List.of(filters), List.of(), LIMIT_UNLIMITED);
  }

  public static QuerySpec of(List<Filter> filters, List<SortField> orders, int limit) {
    return new QuerySpec(filters == null ? List.of() : filters, orders == null ? List.of() : orders, limit);
  }

  public List<Filter> filters() { return filters; }
  public List<SortField> orders() { return orders; }
  public int limit() { return limit; }

  /** True when {@link #limit()} should be pushed down to the store. */
  public boolean hasLimit() { return limit > 0 && limit != LIMIT_UNLIMITED; }

  public boolean isEmpty() { return filters.isEmpty() && orders.isEmpty() && !hasLimit(); }

  public QuerySpec where(Filter filter) {
    Objects.requireNonNull(filter, "filter");
    List<Filter> next = new ArrayList<>(filters);
    next.add(filter);
    return new QuerySpec(next, orders, limit);
  }

  public QuerySpec where(String field, Operator operator, Object value) {
    return where(Filter.of(field, operator, value));
  }

  public QuerySpec where(String field, String operatorSymbol, Object value) {
    return where(Filter.of(field, Operator.parse(operatorSymbol), value));
  }

  public QuerySpec whereDeferred(String field, Operator operator, ValueProvider provider) {
    return where(Filter.deferred(field, operator, provider));
  }

  public QuerySpec orderBy(SortField order) {
    Objects.requireNonNull(order, "order");
    List<SortField> next = new ArrayList<>(orders);
    next.add(order);
    return new QuerySpec(filters, next, limit);
  }

  public QuerySpec orderBy(String field, SortField.Direction direction) {
    return orderBy(new SortField(field, direction));
  }

  public QuerySpec limit(int limit) {
    return new QuerySpec(filters, orders, limit);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof QuerySpec other)) return false;
    return limit == other.limit && filters.equals(other.filters) && orders.equals(other.orders);
  }

  @Override
  public int hashCode() {
    return Objects.hash(filters, orders, limit);
  }

  @Override
  public String toString() {
    return "QuerySpec{filters=" + filters + ", orders=" + orders + ", limit=" + limit + "}";
  }
}
