package io.intellixity.docmap.store;

import io.intellixity.docmap.query.Operator;

import java.util.Objects;

/** A filter whose comparison value has been fully resolved, ready for the store. */
public record Condition(String field, Operator operator, Object value) {
  public Condition {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(operator, "operator");
  }
}
