/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package spanscope.context;

import spanscope.RequestContext;
import spanscope.ServerSpanObserver;
import spanscope.Span;

/**
 * Attaches the object a {@link ContextFactory} makes for each server span to the request context,
 * then follows the server span with a {@link ContextSpanObserver}.
 *
 * <p>One instance exists per registered name for the life of the process. It is added by {@link
 * spanscope.SpanScope.Builder#addToContext(ContextAttribute, ContextFactory)}.
 *
 * @param <T> type of the attached object
 */
public final class ContextObserver<T> implements ServerSpanObserver {
  final ContextAttribute<T> attribute;
  final ContextFactory<? extends T> contextFactory;

  public ContextObserver(ContextAttribute<T> attribute, ContextFactory<? extends T> contextFactory) {
    if (attribute == null) throw new NullPointerException("attribute == null");
    if (contextFactory == null) throw new NullPointerException("contextFactory == null");
    this.attribute = attribute;
    this.contextFactory = contextFactory;
  }

  public ContextAttribute<T> attribute() {
    return attribute;
  }

  public ContextFactory<? extends T> contextFactory() {
    return contextFactory;
  }

  /**
   * Binds a new object to the request-wide scope of the context. Nothing is bound, and no span
   * observer is registered, when the factory fails.
   */
  @Override public void onServerSpanCreated(RequestContext context, Span serverSpan) {
    T contextAttr = makeObject(attribute, contextFactory, serverSpan);
    context.set(attribute.name(), contextAttr);
    serverSpan.register(new ContextSpanObserver<>(attribute, contextFactory));
  }

  static <T> T makeObject(ContextAttribute<T> attribute, ContextFactory<? extends T> factory,
    Span span) {
    T result = factory.makeObjectForContext(attribute.name(), span);
    if (result == null) {
      throw new NullPointerException(
        factory.getClass().getName() + " returned null for " + attribute.name());
    }
    return attribute.type().cast(result);
  }

  @Override public String toString() {
    return "ContextObserver{name=" + attribute.name() + ", contextFactory=" + contextFactory + "}";
  }
}
