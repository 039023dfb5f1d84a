/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package spanscope;

/**
 * Notified when a {@linkplain Span.Kind#SERVER server span} is created, which is once per inbound
 * request. Implementations usually {@linkplain Span#register(SpanObserver) register} a {@link
 * SpanObserver} to follow the rest of the request.
 *
 * <p>This is called before any application code runs under the span. Exceptions are not caught:
 * they fail the creation of the server span, and therefore the request.
 *
 * <p><em>Note</em>: This type is safe to implement as a lambda, or use as a method reference as it
 * is effectively a {@code FunctionalInterface}.
 *
 * @see SpanScope.Builder#addObserver(ServerSpanObserver)
 */
// Do not add methods as it will break lambda usage!
public interface ServerSpanObserver {

  /**
   * @param context the root scope of the request, which {@link RequestContext#span()} binds to the
   * server span.
   * @param serverSpan the new span, which is not yet started.
   */
  void onServerSpanCreated(RequestContext context, Span serverSpan);
}
