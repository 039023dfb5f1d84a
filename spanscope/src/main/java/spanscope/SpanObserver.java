/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package spanscope;

/**
 * Follows the lifecycle of one span it was {@linkplain Span#register(SpanObserver) registered} on.
 * All callbacks are no-op by default.
 *
 * <p>Callbacks run on the same thread as application code, in the order observers were
 * registered. Exceptions are not caught, so they surface from the span operation that triggered
 * them.
 *
 * <p>Observers are discarded when their span {@linkplain Span#finish() finishes}. They are never
 * inherited by child spans. To follow descendants, register a new observer from {@link
 * #onChildSpanCreated(Span)}.
 */
public abstract class SpanObserver {
  /** Called on {@link Span#start()}. */
  public void onStart(Span span) {
  }

  /** Called on {@link Span#tag(String, String)}. */
  public void onTag(Span span, String key, String value) {
  }

  /** Called on {@link Span#annotate(long, String)}. */
  public void onAnnotate(Span span, long timestamp, String value) {
  }

  /**
   * Called once when a child of the observed span is created, before it is returned to the
   * caller. Use {@link Span#kind()} to tell in-process work from outbound calls.
   */
  public void onChildSpanCreated(Span child) {
  }

  /**
   * Called once on {@link Span#finish()}, after which this observer is discarded.
   *
   * @param span the finished span. {@link Span#error()} is set if the operation failed.
   */
  public void onFinish(Span span) {
  }
}
