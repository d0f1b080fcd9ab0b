package io.intellixity.docmap.record;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Resolves the {@link RecordAdapter} of a record type.
 * <p>
 * An adapter registered through {@link RecordAdapterProvider} wins; otherwise one is derived from
 * {@link DocumentField} / {@link DocumentId} annotations. Either way the result is computed once per class.
 */
public final class RecordAdapters {
  private RecordAdapters() {}

  private static final class Registry {
    static final DiscoveredRecordAdapterRegistry INSTANCE = new DiscoveredRecordAdapterRegistry();
  }

  private static final ClassValue<RecordAdapter<?>> CACHE = new ClassValue<>() {
    @Override
    protected RecordAdapter<?> computeValue(Class<?> type) {
      RecordAdapter<?> registered = Registry.INSTANCE.find(type);
      return registered != null ? registered : derive(type);
    }
  };

  @SuppressWarnings("unchecked")
  public static <T> RecordAdapter<T> of(Class<T> type) {
    Objects.requireNonNull(type, "type");
    return (RecordAdapter<T>) CACHE.get(type);
  }

  @SuppressWarnings("unchecked")
  public static <T> RecordAdapter<T> forRecord(T record) {
    Objects.requireNonNull(record, "record");
    return of((Class<T>) record.getClass());
  }

  /** Builds an adapter from annotations, bypassing the registry and the cache. */
  public static <T> RecordAdapter<T> derive(Class<T> type) {
    if (type.isInterface() || type.isPrimitive() || type.isArray() || Modifier.isAbstract(type.getModifiers())) {
      throw new FieldMappingException(type, null, "model must be a concrete class");
    }
    if (type.isRecord()) {
      throw new FieldMappingException(type, null, "record classes are immutable; register a RecordAdapter or use a mutable class");
    }

    RecordAdapter.Builder<T> b = RecordAdapter.builder(type, constructor(type));
    List<Field> all = hierarchyFields(type);

    Field id = identifierField(type, all);
    if (id != null) {
      id.setAccessible(true);
      boolean settable = !Modifier.isFinal(id.getModifiers());
      b.id(r -> (String) read(type, id, r), settable ? (r, v) -> write(type, id, r, v) : null);
    }

    for (Field f : all) {
      if (f.equals(id)) continue;
      DocumentField df = f.getAnnotation(DocumentField.class);
      if (df == null) continue;
      String name = df.value().trim();
      if (name.isEmpty() || DocumentField.IGNORE.equals(name)) continue;
      if (Modifier.isStatic(f.getModifiers()) || Modifier.isFinal(f.getModifiers())) {
        throw new FieldMappingException(type, name, "mapped field '" + f.getName() + "' must be a non-final instance field");
      }
      f.setAccessible(true);
      b.binding(new FieldBinding<>(name, f.getType(), r -> read(type, f, r), (r, v) -> write(type, f, r, v)));
    }
    return b.build();
  }

  private static <T> Supplier<T> constructor(Class<T> type) {
    Constructor<T> ctor;
    try {
      ctor = type.getDeclaredConstructor();
    } catch (NoSuchMethodException e) {
      throw new FieldMappingException(type, null, "model needs a no-arg constructor", e);
    }
    ctor.setAccessible(true);
    return () -> {
      try {
        return ctor.newInstance();
      } catch (ReflectiveOperationException e) {
        throw new FieldMappingException(type, null, "failed to instantiate model", e);
      }
    };
  }

  /** Superclass fields first, so subclass declarations read last. */
  private static List<Field> hierarchyFields(Class<?> type) {
    Deque<Class<?>> chain = new ArrayDeque<>();
    for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) chain.push(c);
    List<Field> out = new ArrayList<>();
    for (Class<?> c : chain) {
      for (Field f : c.getDeclaredFields()) {
        if (!f.isSynthetic()) out.add(f);
      }
    }
    return out;
  }

  private static Field identifierField(Class<?> type, List<Field> fields) {
    Field annotated = null;
    for (Field f : fields) {
      if (!f.isAnnotationPresent(DocumentId.class)) continue;
      if (annotated != null) {
        throw new FieldMappingException(type, null, "more than one @DocumentId field: "
            + annotated.getName() + ", " + f.getName());
      }
      annotated = f;
    }
    if (annotated != null) return isIdCandidate(annotated) ? annotated : null;

    for (Field f : fields) {
      if (("id".equals(f.getName()) || "ID".equals(f.getName())) && isIdCandidate(f)) return f;
    }
    return null;
  }

  private static boolean isIdCandidate(Field f) {
    return f.getType() == String.class && !Modifier.isStatic(f.getModifiers());
  }

  private static Object read(Class<?> type, Field f, Object target) {
    try {
      return f.get(target);
    } catch (IllegalAccessException e) {
      throw new FieldMappingException(type, f.getName(), "cannot read field", e);
    }
  }

  private static void write(Class<?> type, Field f, Object target, Object value) {
    try {
      f.set(target, value);
    } catch (IllegalAccessException e) {
      throw new FieldMappingException(type, f.getName(), "cannot write field", e);
    }
  }
}
