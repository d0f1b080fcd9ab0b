package io.intellixity.docmap.mongo;

import io.intellixity.docmap.query.Operator;
import io.intellixity.docmap.query.SortField;
import io.intellixity.docmap.store.Condition;
import io.intellixity.docmap.store.FieldUpdate;
import io.intellixity.docmap.store.StoreQuery;
import io.intellixity.docmap.store.StoredDocument;
import org.bson.Document;
import org.bson.types.ObjectId;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link StoreQuery} to MongoDB BSON.
 * <p>
 * Results are always sorted by the query's orders followed by {@code _id}, which makes paging stable;
 * a {@link StoreQuery#startAfter()} cursor becomes a keyset predicate over that same sort key.
 */
final class MongoQueryRenderer {
  static final String ID = "_id";

  private MongoQueryRenderer() {}

  static Document filter(StoreQuery q) {
    List<Document> parts = new ArrayList<>();
    for (Condition c : q.conditions()) parts.add(condition(c));
    if (q.startAfter() != null) parts.add(keyset(q.orders(), q.startAfter()));
    if (parts.isEmpty()) return new Document();
    if (parts.size() == 1) return parts.get(0);
    return new Document("$and", parts);
  }

  static Document sort(List<SortField> orders) {
    Document d = new Document();
    for (SortField sf : orders) d.append(sf.field(), direction(sf));
    if (!d.containsKey(ID)) d.append(ID, 1);
    return d;
  }

  static Document set(List<FieldUpdate> updates) {
    Document set = new Document();
    for (FieldUpdate u : updates) set.append(u.path(), u.value());
    return new Document("$set", set);
  }

  static Document condition(Condition c) {
    String path = c.field();
    Object v = c.value();
    Operator op = c.operator();
    return switch (op) {
      case EQ -> new Document(path, v);
      case NE -> new Document(path, new Document("$ne", v));
      case LT -> new Document(path, new Document("$lt", requireNonNull(op, v)));
      case LE -> new Document(path, new Document("$lte", requireNonNull(op, v)));
      case GT -> new Document(path, new Document("$gt", requireNonNull(op, v)));
      case GE -> new Document(path, new Document("$gte", requireNonNull(op, v)));
      case IN -> new Document(path, new Document("$in", toList(op, v)));
      case NOT_IN -> new Document(path, new Document("$nin", toList(op, v)));
      case ARRAY_CONTAINS -> new Document(path, new Document("$elemMatch", new Document("$eq", v)));
      case ARRAY_CONTAINS_ANY -> new Document(path, new Document("$elemMatch", new Document("$in", toList(op, v))));
    };
  }

  /**
   * (a after v1) OR (a = v1 AND b after v2) OR ... OR (a = v1 AND ... AND _id after id), where "after"
   * follows Mongo sort order: null and missing sort before every value, strings before ObjectIds.
   */
  static Document keyset(List<SortField> orders, StoredDocument cursor) {
    List<SortField> key = new ArrayList<>(orders);
    boolean hasId = false;
    for (SortField sf : orders) hasId |= ID.equals(sf.field());
    if (!hasId) key.add(SortField.asc(ID));

    List<Document> or = new ArrayList<>();
    for (int i = 0; i < key.size(); i++) {
      SortField sf = key.get(i);
      Document after = after(sf, cursorValue(cursor, sf.field()));
      if (after == null) continue;
      List<Document> and = new ArrayList<>();
      for (int j = 0; j < i; j++) {
        SortField eq = key.get(j);
        and.add(new Document(eq.field(), cursorValue(cursor, eq.field())));
      }
      and.add(after);
      or.add(and.size() == 1 ? and.get(0) : new Document("$and", and));
    }
    return or.size() == 1 ? or.get(0) : new Document("$or", or);
  }

  /** Values strictly after {@code v} in {@code sf}'s direction; null when nothing sorts after it. */
  private static Document after(SortField sf, Object v) {
    String path = sf.field();
    boolean desc = sf.direction() == SortField.Direction.DESC;
    if (ID.equals(path)) return afterId(desc, v);
    if (v == null) return desc ? null : new Document(path, new Document("$ne", null));
    if (!desc) return new Document(path, new Document("$gt", v));
    return new Document("$or", List.of(new Document(path, new Document("$lt", v)), new Document(path, null)));
  }

  private static Document afterId(boolean desc, Object v) {
    Document cmp = new Document(ID, new Document(desc ? "$lt" : "$gt", v));
    boolean oid = v instanceof ObjectId;
    // ascending past a string id reaches the ObjectIds; descending past an ObjectId reaches the strings
    if (desc != oid) return cmp;
    return new Document("$or", List.of(cmp, new Document(ID, new Document("$type", oid ? "string" : "objectId"))));
  }

  private static Object cursorValue(StoredDocument cursor, String path) {
    if (ID.equals(path)) return MongoDocuments.idValue(cursor.id());
    Object cur = cursor.fields();
    for (String p : path.split("\\.")) {
      if (!(cur instanceof Map<?, ?> m)) return null;
      cur = m.get(p);
    }
    return cur;
  }

  private static int direction(SortField sf) {
    return sf.direction() == SortField.Direction.DESC ? -1 : 1;
  }

  private static Object requireNonNull(Operator op, Object v) {
    if (v == null) throw new IllegalArgumentException(op.symbol() + " requires non-null value");
    return v;
  }

  private static List<?> toList(Operator op, Object v) {
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    if (v instanceof Object[] a) return Arrays.asList(a);
    throw new IllegalArgumentException(op.symbol() + " requires a collection value");
  }
}
