package io.intellixity.docmap.record;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Maps a record field to a document field.
 * <p>
 * {@link #value()} is the document field name. An empty name or {@link #IGNORE} leaves the field unmapped,
 * exactly like a field that carries no annotation.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface DocumentField {
  String IGNORE = "-";

  String value();
}
