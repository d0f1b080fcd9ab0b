package io.intellixity.docmap.record;

import io.intellixity.docmap.DocmapException;

/** A record field could not be read, written or described. */
public final class FieldMappingException extends DocmapException {
  private final Class<?> model;
  private final String field;

  public FieldMappingException(Class<?> model, String field, String message) {
    super(describe(model, field) + message);
    this.model = model;
    this.field = field;
  }

  public FieldMappingException(Class<?> model, String field, String message, Throwable cause) {
    super(describe(model, field) + message, cause);
    this.model = model;
    this.field = field;
  }

  public Class<?> model() { return model; }

  /** Document field name; null when the failure concerns the whole type. */
  public String field() { return field; }

  private static String describe(Class<?> model, String field) {
    String m = model == null ? "?" : model.getSimpleName();
    return field == null ? m + ": " : m + "." + field + ": ";
  }
}
