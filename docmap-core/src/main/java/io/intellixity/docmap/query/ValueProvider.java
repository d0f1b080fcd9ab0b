package io.intellixity.docmap.query;

/**
 * Supplies a filter's comparison value when the query is applied rather than when it is built,
 * e.g. "the last cursor this consumer processed".
 * <p>
 * Called exactly once per application of the owning query; results are never cached.
 */
@FunctionalInterface
public interface ValueProvider {
  Object value() throws Exception;
}
