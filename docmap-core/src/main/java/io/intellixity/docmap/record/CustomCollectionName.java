package io.intellixity.docmap.record;

/** Implemented by record types whose collection is not the default {@code lowercase(simpleName) + "s"}. */
public interface CustomCollectionName {
  String collectionName();
}
