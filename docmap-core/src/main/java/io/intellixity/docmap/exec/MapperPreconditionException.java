package io.intellixity.docmap.exec;

import io.intellixity.docmap.DocmapException;

/** A mapper call was rejected locally, before any store round-trip. */
public final class MapperPreconditionException extends DocmapException {
  public MapperPreconditionException(String message) {
    super(message);
  }
}
