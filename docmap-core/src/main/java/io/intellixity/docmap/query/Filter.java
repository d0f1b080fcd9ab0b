package io.intellixity.docmap.query;

import java.util.Objects;

/**
 * One where-clause. When {@code provider} is set it wins over {@code value}.
 */
public record Filter(String field, Operator operator, Object value, ValueProvider provider) {
  public Filter {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(operator, "operator");
    if (field.isBlank()) throw new IllegalArgumentException("field is required");
  }

  public static Filter of(String field, Operator operator, Object value) {
    return new Filter(field, operator, value, null);
  }

  public static Filter deferred(String field, Operator operator, ValueProvider provider) {
    return new Filter(field, operator, null, Objects.requireNonNull(provider, "provider"));
  }

  public boolean deferred() { return provider != null; }
}
