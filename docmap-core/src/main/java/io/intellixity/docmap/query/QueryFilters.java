package io.intellixity.docmap.query;

import java.util.Collection;
import java.util.List;

public final class QueryFilters {
  private QueryFilters() {}

  public static Filter eq(String field, Object value) { return Filter.of(field, Operator.EQ, value); }
  public static Filter ne(String field, Object value) { return Filter.of(field, Operator.NE, value); }
  public static Filter gt(String field, Object value) { return Filter.of(field, Operator.GT, value); }
  public static Filter ge(String field, Object value) { return Filter.of(field, Operator.GE, value); }
  public static Filter lt(String field, Object value) { return Filter.of(field, Operator.LT, value); }
  public static Filter le(String field, Object value) { return Filter.of(field, Operator.LE, value); }

  public static Filter in(String field, Collection<?> values) { return Filter.of(field, Operator.IN, List.copyOf(values)); }
  public static Filter notIn(String field, Collection<?> values) { return Filter.of(field, Operator.NOT_IN, List.copyOf(values)); }

  public static Filter arrayContains(String field, Object value) { return Filter.of(field, Operator.ARRAY_CONTAINS, value); }
  public static Filter arrayContainsAny(String field, Collection<?> values) {
    return Filter.of(field, Operator.ARRAY_CONTAINS_ANY, List.copyOf(values));
  }

  /** Comparison against a value resolved when the query is applied. */
  public static Filter deferred(String field, Operator operator, ValueProvider provider) {
    return Filter.deferred(field, operator, provider);
  }
}
