/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package spanscope.context;

import io.micrometer.core.instrument.MeterRegistry;
import spanscope.Span;
import spanscope.SpanScope;

/**
 * Makes the object attached to the request context under a name, usually a client library handle
 * that reports to the span it was made for.
 *
 * <p>For example, to expose a span-aware database handle as "db":
 * <pre>{@code
 * class DatabaseContextFactory extends ContextFactory<Database> {
 *   final DataSource dataSource;
 *
 *   @Override public Database makeObjectForContext(String name, Span span) {
 *     return new TracedDatabase(dataSource, span);
 *   }
 *
 *   @Override public void reportRuntimeMetrics(MeterRegistry registry) {
 *     registry.gauge("db.pool.active", dataSource, DataSource::activeConnections);
 *   }
 * }
 *
 * spanScope = SpanScope.newBuilder()
 *                      .addToContext(DB, new DatabaseContextFactory(dataSource))
 *                      .build();
 * }</pre>
 *
 * <p>Code serving the request then reads {@code DB.getValue(context)}.
 *
 * @param <T> type of the object made for each span
 * @see SpanScope.Builder#addToContext(ContextAttribute, ContextFactory)
 */
public abstract class ContextFactory<T> {
  /**
   * Reports runtime metrics of the underlying client, such as connection pool usage. This is
   * invoked by a periodic reporter via {@link SpanScope#reportRuntimeMetrics(MeterRegistry)}.
   * Default is a no-op.
   */
  public void reportRuntimeMetrics(MeterRegistry registry) {
  }

  /**
   * Returns the object to attach to the request context for the given span. Every factory must
   * override this: the default throws {@link UnsupportedOperationException}.
   *
   * <p>This is called once for the {@linkplain Span.Kind#SERVER server span} of each request, and
   * once more for each {@linkplain Span.Kind#LOCAL local} child of it. Exceptions are not caught:
   * they fail the span creation that triggered this call.
   *
   * @param name the name the result will be bound to
   * @param span the span code using the result runs under
   * @return a non-null object
   */
  public T makeObjectForContext(String name, Span span) {
    throw new UnsupportedOperationException(
      getClass().getName() + " does not implement makeObjectForContext");
  }
}
