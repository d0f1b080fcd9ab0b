package io.intellixity.docmap.store;

import java.util.Objects;

/** Field-path update: set {@code path} (dot-separated for nested fields) to {@code value}. */
public record FieldUpdate(String path, Object value) {
  public FieldUpdate {
    Objects.requireNonNull(path, "path");
    if (path.isBlank()) throw new IllegalArgumentException("path is required");
  }

  public static FieldUpdate of(String path, Object value) {
    return new FieldUpdate(path, value);
  }
}
