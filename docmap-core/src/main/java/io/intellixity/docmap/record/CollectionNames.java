package io.intellixity.docmap.record;

import java.util.Locale;
import java.util.Objects;

public final class CollectionNames {
  private CollectionNames() {}

  /**
   * Collection for {@code adapter}'s type: {@link CustomCollectionName#collectionName()} when implemented
   * (asked of {@code instance}, or a fresh instance when null), else {@code lowercase(simpleName) + "s"}.
   */
  public static <T> String resolve(RecordAdapter<T> adapter, T instance) {
    Objects.requireNonNull(adapter, "adapter");
    if (CustomCollectionName.class.isAssignableFrom(adapter.type())) {
      T target = (instance != null) ? instance : adapter.newInstance();
      String name = ((CustomCollectionName) target).collectionName();
      if (name == null || name.isBlank()) {
        throw new FieldMappingException(adapter.type(), null, "collectionName() returned a blank name");
      }
      return name;
    }
    return defaultName(adapter.type());
  }

  public static String defaultName(Class<?> type) {
    return type.getSimpleName().toLowerCase(Locale.ROOT) + "s";
  }
}
