package io.intellixity.docmap.record;

import java.util.List;

/**
 * Publishes explicitly built {@link RecordAdapter}s.
 * <p>
 * List implementations in {@code META-INF/docmap.factories} under this interface's name.
 * A registered adapter takes precedence over annotation-derived mapping for its type.
 */
public interface RecordAdapterProvider {
  List<RecordAdapter<?>> recordAdapters();
}
