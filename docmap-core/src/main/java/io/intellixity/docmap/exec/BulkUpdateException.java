package io.intellixity.docmap.exec;

import io.intellixity.docmap.DocmapException;

/**
 * A by-query update stopped part way. Pages committed before the failure stay committed;
 * atomicity holds within one page only.
 */
public final class BulkUpdateException extends DocmapException {
  private final long committedPages;
  private final long committedDocuments;

  public BulkUpdateException(String message, long committedPages, long committedDocuments, Throwable cause) {
    super(message + " (committed pages=" + committedPages + ", documents=" + committedDocuments + "): "
        + cause.getMessage(), cause);
    this.committedPages = committedPages;
    this.committedDocuments = committedDocuments;
  }

  public long committedPages() { return committedPages; }
  public long committedDocuments() { return committedDocuments; }
}
