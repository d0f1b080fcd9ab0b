package io.intellixity.docmap.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/** Canonical JSON serializer for {@link QuerySpec}. */
public final class QuerySpecJsonSerializer extends JsonSerializer<QuerySpec> {
  @Override
  public void serialize(QuerySpec spec, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (spec == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();

    if (!spec.filters().isEmpty()) {
      g.writeArrayFieldStart("where");
      for (Filter f : spec.filters()) {
        if (f.deferred()) {
          throw JsonMappingException.from(g, "Filter on '" + f.field() + "' has a deferred value and cannot be serialized");
        }
        g.writeStartObject();
        g.writeStringField("field", f.field());
        g.writeStringField("op", f.operator().symbol());
        g.writeFieldName("value");
        serializers.defaultSerializeValue(f.value(), g);
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (!spec.orders().isEmpty()) {
      g.writeArrayFieldStart("orderBy");
      for (SortField sf : spec.orders()) {
        g.writeStartObject();
        g.writeStringField("field", sf.field());
        g.writeStringField("dir", sf.direction().name());
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (spec.hasLimit()) {
      g.writeNumberField("limit", spec.limit());
    }

    g.writeEndObject();
  }
}
