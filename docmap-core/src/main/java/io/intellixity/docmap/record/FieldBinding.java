package io.intellixity.docmap.record;

import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Accessor pair for one mapped field.
 *
 * @param name document field name
 * @param type declared Java type; decoded values are coerced to it
 */
public record FieldBinding<T>(String name, Class<?> type, Function<T, Object> getter, BiConsumer<T, Object> setter) {
  public FieldBinding {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(getter, "getter");
    Objects.requireNonNull(setter, "setter");
  }
}
