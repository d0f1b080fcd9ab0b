package io.intellixity.docmap.store;

import io.intellixity.docmap.DocmapException;

/**
 * Raised when a single document lookup (or a store-level update of one document) finds nothing.
 * <p>
 * Kept apart from {@link StoreException} so callers can branch on "absent" vs "broken".
 */
public class DocumentNotFoundException extends DocmapException {
  private final String collection;
  private final String documentId;

  public DocumentNotFoundException(String collection, String documentId) {
    super(documentId == null
        ? "no document found in collection '" + collection + "'"
        : "document '" + documentId + "' not found in collection '" + collection + "'");
    this.collection = collection;
    this.documentId = documentId;
  }

  public String collection() { return collection; }

  /** Null when the lookup was a query rather than a key. */
  public String documentId() { return documentId; }

  /** True if {@code t} or any of its causes is a {@link DocumentNotFoundException}. */
  public static boolean isNotFound(Throwable t) {
    for (Throwable cur = t; cur != null; cur = cur.getCause()) {
      if (cur instanceof DocumentNotFoundException) return true;
      if (cur.getCause() == cur) break;
    }
    return false;
  }
}
