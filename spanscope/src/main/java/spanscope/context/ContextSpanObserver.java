/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package spanscope.context;

import spanscope.Span;
import spanscope.SpanObserver;

/**
 * Attaches a fresh object for each {@linkplain Span.Kind#LOCAL local} child of the observed span,
 * shadowing the parent's object in the child's scope only. Code running under the child sees the
 * new object, while the parent and its other children keep seeing theirs.
 *
 * <p>{@linkplain Span.Kind#REMOTE Remote} children are skipped, as the parent's object stays valid
 * across a network boundary. Any other kind is skipped the same way.
 *
 * <p>Only direct children of the observed span are handled, as no observer is registered on the
 * children. Deeper local spans see the object of their nearest handled ancestor.
 *
 * <p>One instance is registered per server span, and is discarded when that span finishes.
 *
 * @param <T> type of the attached object
 */
public final class ContextSpanObserver<T> extends SpanObserver {
  final ContextAttribute<T> attribute;
  final ContextFactory<? extends T> contextFactory;

  ContextSpanObserver(ContextAttribute<T> attribute, ContextFactory<? extends T> contextFactory) {
    this.attribute = attribute;
    this.contextFactory = contextFactory;
  }

  @Override public void onChildSpanCreated(Span child) {
    switch (child.kind()) {
      case LOCAL:
        T contextAttr = ContextObserver.makeObject(attribute, contextFactory, child);
        child.requestContext().shadow(attribute.name(), contextAttr);
        return;
      case REMOTE:
      default:
        // keep the object bound to the parent
    }
  }

  @Override public String toString() {
    return "ContextSpanObserver{name=" + attribute.name() + "}";
  }
}
