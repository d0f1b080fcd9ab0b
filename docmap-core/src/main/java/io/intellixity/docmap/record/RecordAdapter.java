package io.intellixity.docmap.record;

import io.intellixity.docmap.store.StoredDocument;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Field-descriptor table for one record type: document field name to accessor pair, plus the identifier.
 * <p>
 * Built once per type (by {@link #builder(Class, Supplier)} or derived from annotations by
 * {@link RecordAdapters#of(Class)}) and shared; instances are immutable and thread-safe.
 */
public final class RecordAdapter<T> {
  private final Class<T> type;
  private final Supplier<T> factory;
  private final Function<T, String> idGetter;
  private final BiConsumer<T, String> idSetter;
  private final Map<String, FieldBinding<T>> fields;

  private RecordAdapter(Builder<T> b) {
    this.type = b.type;
    this.factory = b.factory;
    this.idGetter = b.idGetter;
    this.idSetter = b.idSetter;
    this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(b.fields));
  }

  public static <T> Builder<T> builder(Class<T> type, Supplier<T> factory) {
    return new Builder<>(type, factory);
  }

  public Class<T> type() { return type; }
  public boolean hasId() { return idGetter != null; }
  public Set<String> fieldNames() { return fields.keySet(); }
  public Map<String, FieldBinding<T>> fields() { return fields; }

  public T newInstance() {
    T out = factory.get();
    if (out == null) throw new FieldMappingException(type, null, "factory returned null");
    return out;
  }

  /** Identifier of {@code record}, or {@code ""} when the type has none or it is unset. */
  public String extractId(T record) {
    if (record == null || idGetter == null) return "";
    String id = idGetter.apply(record);
    return id == null ? "" : id;
  }

  /** Sets the identifier; no-op when the type has no settable identifier. */
  public void injectId(T record, String id) {
    if (record == null || idSetter == null) return;
    idSetter.accept(record, id);
  }

  /** Document field name to current value for every mapped field. The identifier is not included. */
  public Map<String, Object> toFieldMapping(T record) {
    Objects.requireNonNull(record, "record");
    Map<String, Object> out = new LinkedHashMap<>();
    for (FieldBinding<T> f : fields.values()) {
      out.put(f.name(), f.getter().apply(record));
    }
    return out;
  }

  /**
   * Copies the document's fields into {@code dest} and injects the document id.
   * Fields absent from the document keep their current value.
   */
  public T decode(StoredDocument doc, T dest) {
    Objects.requireNonNull(doc, "doc");
    Objects.requireNonNull(dest, "dest");
    Map<String, Object> data = doc.fields();
    for (FieldBinding<T> f : fields.values()) {
      if (!data.containsKey(f.name())) continue;
      Object raw = data.get(f.name());
      if (raw == null && f.type().isPrimitive()) continue;
      Object value;
      try {
        value = Coercions.coerce(raw, f.type());
      } catch (IllegalArgumentException | ArithmeticException | ClassCastException e) {
        throw new FieldMappingException(type, f.name(), "failed to parse document " + doc.id() + ": " + e.getMessage(), e);
      }
      f.setter().accept(dest, value);
    }
    injectId(dest, doc.id());
    return dest;
  }

  public T decode(StoredDocument doc) {
    return decode(doc, newInstance());
  }

  @Override
  public String toString() {
    return "RecordAdapter{" + type.getName() + ", id=" + hasId() + ", fields=" + fields.keySet() + "}";
  }

  public static final class Builder<T> {
    private final Class<T> type;
    private final Supplier<T> factory;
    private Function<T, String> idGetter;
    private BiConsumer<T, String> idSetter;
    private final Map<String, FieldBinding<T>> fields = new LinkedHashMap<>();

    private Builder(Class<T> type, Supplier<T> factory) {
      this.type = Objects.requireNonNull(type, "type");
      this.factory = Objects.requireNonNull(factory, "factory");
    }

    /** Identifier accessors; {@code setter} may be null for read-only identifiers. */
    public Builder<T> id(Function<T, String> getter, BiConsumer<T, String> setter) {
      this.idGetter = Objects.requireNonNull(getter, "getter");
      this.idSetter = setter;
      return this;
    }

    @SuppressWarnings("unchecked")
    public <V> Builder<T> field(String name, Class<V> valueType, Function<T, V> getter, BiConsumer<T, V> setter) {
      Objects.requireNonNull(getter, "getter");
      Objects.requireNonNull(setter, "setter");
      return binding(new FieldBinding<>(name, valueType, getter::apply, (r, v) -> setter.accept(r, (V) v)));
    }

    Builder<T> binding(FieldBinding<T> binding) {
      String name = binding.name().trim();
      if (name.isEmpty() || DocumentField.IGNORE.equals(name)) {
        throw new IllegalArgumentException("'" + binding.name() + "' is not a mappable field name on " + type.getName());
      }
      if (fields.containsKey(name)) {
        throw new IllegalArgumentException("Duplicate document field '" + name + "' on " + type.getName());
      }
      fields.put(name, new FieldBinding<>(name, binding.type(), binding.getter(), binding.setter()));
      return this;
    }

    public RecordAdapter<T> build() {
      return new RecordAdapter<>(this);
    }
  }
}
