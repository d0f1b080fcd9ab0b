package io.intellixity.docmap.query;

import io.intellixity.docmap.DocmapException;

/** A deferred filter value could not be resolved while applying a query. */
public final class QueryResolutionException extends DocmapException {
  private final String field;

  public QueryResolutionException(String field, Throwable cause) {
    super("failed to get value for field " + field + ": " + cause.getMessage(), cause);
    this.field = field;
  }

  public String field() { return field; }
}
