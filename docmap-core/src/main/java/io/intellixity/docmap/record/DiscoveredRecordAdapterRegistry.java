package io.intellixity.docmap.record;

import io.intellixity.docmap.util.DocmapFactoriesLoader;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Explicit {@link RecordAdapter}s collected from every discovered {@link RecordAdapterProvider}. */
public final class DiscoveredRecordAdapterRegistry {
  private final Map<Class<?>, RecordAdapter<?>> byType;

  public DiscoveredRecordAdapterRegistry() {
    this(DocmapFactoriesLoader.load(RecordAdapterProvider.class));
  }

  DiscoveredRecordAdapterRegistry(List<RecordAdapterProvider> providers) {
    Map<Class<?>, RecordAdapter<?>> out = new HashMap<>();
    for (RecordAdapterProvider p : providers) {
      if (p == null) continue;
      List<RecordAdapter<?>> adapters = p.recordAdapters();
      if (adapters == null) continue;
      for (RecordAdapter<?> a : adapters) {
        if (a == null) continue;
        RecordAdapter<?> existing = out.putIfAbsent(a.type(), a);
        if (existing != null) {
          throw new IllegalArgumentException("Duplicate RecordAdapter for " + a.type().getName()
              + " from provider " + p.getClass().getName());
        }
      }
    }
    this.byType = Map.copyOf(out);
  }

  /** Registered adapter for {@code type}, or null. */
  @SuppressWarnings("unchecked")
  public <T> RecordAdapter<T> find(Class<T> type) {
    return (RecordAdapter<T>) byType.get(type);
  }

  public int size() { return byType.size(); }
}
