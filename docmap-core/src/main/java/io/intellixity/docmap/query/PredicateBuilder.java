package io.intellixity.docmap.query;

import io.intellixity.docmap.store.StoreQuery;

import java.util.List;
import java.util.Objects;

/**
 * Folds {@link QuerySpec}s onto a {@link StoreQuery}.
 * <p>
 * Specs are applied in the given order. Within one spec: filters, then orders, then the limit
 * (only when {@link QuerySpec#hasLimit()}). Deferred filter values are resolved here, once per call.
 */
public final class PredicateBuilder {
  private PredicateBuilder() {}

  public static StoreQuery apply(StoreQuery base, List<QuerySpec> specs) {
    Objects.requireNonNull(base, "base");
    if (specs == null || specs.isEmpty()) return base;

    StoreQuery q = base;
    for (QuerySpec spec : specs) {
      if (spec == null) continue;
      for (Filter f : spec.filters()) {
        q = q.where(f.field(), f.operator(), resolve(f));
      }
      for (SortField o : spec.orders()) {
        q = q.orderBy(o);
      }
      if (spec.hasLimit()) {
        q = q.limit(spec.limit());
      }
    }
    return q;
  }

  private static Object resolve(Filter f) {
    if (!f.deferred()) return f.value();
    try {
      return f.provider().value();
    } catch (Exception e) {
      throw new QueryResolutionException(f.field(), e);
    }
  }
}
