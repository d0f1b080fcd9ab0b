package io.intellixity.docmap.store;

import io.intellixity.docmap.DocmapException;

/** Transport, permission or quota failure reported by a {@link DocumentStore}, wrapped with context. */
public class StoreException extends DocmapException {
  public StoreException(String message) {
    super(message);
  }

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
