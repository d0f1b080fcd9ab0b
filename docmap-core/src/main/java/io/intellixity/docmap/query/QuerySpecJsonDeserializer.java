package io.intellixity.docmap.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Canonical JSON deserializer for {@link QuerySpec}. */
public final class QuerySpecJsonDeserializer extends JsonDeserializer<QuerySpec> {
  @Override
  public QuerySpec deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("QuerySpec JSON must be an object");

    List<Filter> filters = new ArrayList<>();
    JsonNode where = root.get("where");
    if (where != null && where.isArray()) {
      for (JsonNode w : where) {
        if (!w.isObject()) throw new IllegalArgumentException("where entries must be objects: " + w);
        String field = textOrNull(w.get("field"));
        if (field == null) throw new IllegalArgumentException("where entry requires field: " + w);
        String op = textOrNull(w.get("op"));
        if (op == null) op = textOrNull(w.get("operator"));
        filters.add(Filter.of(field, Operator.parse(op), decodeValue(w.get("value"), codec)));
      }
    }

    List<SortField> orders = new ArrayList<>();
    JsonNode orderBy = root.get("orderBy");
    if (orderBy != null && orderBy.isArray()) {
      for (JsonNode o : orderBy) {
        if (!o.isObject()) continue;
        String f = textOrNull(o.get("field"));
        if (f == null) continue;
        String dir = textOrNull(o.get("dir"));
        SortField.Direction d = (dir == null) ? SortField.Direction.ASC : SortField.Direction.valueOf(dir.toUpperCase(Locale.ROOT));
        orders.add(new SortField(f, d));
      }
    }

    int limit = intOrDefault(root.get("limit"), QuerySpec.LIMIT_UNLIMITED);
    return QuerySpec.of(filters, orders, limit);
  }

  private static Object decodeValue(JsonNode v, ObjectCodec codec) throws IOException {
    if (v == null || v.isNull()) return null;
    return codec.treeToValue(v, Object.class);
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static int intOrDefault(JsonNode n, int def) {
    if (n == null || n.isNull()) return def;
    return n.isNumber() ? n.intValue() : Integer.parseInt(n.asText());
  }
}
