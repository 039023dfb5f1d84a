/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package spanscope;

import java.io.Closeable;
import java.util.Arrays;
import spanscope.internal.Nullable;
import spanscope.internal.Platform;
import spanscope.propagation.CurrentRequestContext;
import spanscope.propagation.CurrentRequestContext.Scope;
import spanscope.propagation.TraceContext;

/**
 * Using a tracer, you create the server span of each inbound request. Creating it notifies every
 * {@link ServerSpanObserver}, which is how objects such as client handles get attached to the
 * request context before any application code runs.
 *
 * <pre>{@code
 * RequestContext context = RequestContext.create();
 * Span span = tracer.newServerSpan(context, "get /users").start();
 * try (SpanInScope ws = tracer.withSpanInScope(span)) {
 *   return handler.handle(context);
 * } catch (RuntimeException | Error e) {
 *   span.error(e);
 *   throw e;
 * } finally {
 *   span.finish();
 * }
 * }</pre>
 *
 * @see Span#newLocalChild(String)
 * @see Span#newRemoteChild(String)
 */
public final class Tracer {
  final Clock clock;
  final ServerSpanObserver[] observers;
  final CurrentRequestContext currentRequestContext;

  Tracer(Clock clock, ServerSpanObserver[] observers,
    CurrentRequestContext currentRequestContext) {
    this.clock = clock;
    this.observers = observers;
    this.currentRequestContext = currentRequestContext;
  }

  /** Creates the server span of a request that starts a new trace. */
  public Span newServerSpan(RequestContext context, String name) {
    long id = nextId();
    return serverSpan(context, name, TraceContext.newBuilder().traceId(id).spanId(id).build());
  }

  /**
   * Creates the server span of a request that continues a trace started upstream. The incoming
   * identifiers are used as-is, as the client and server sides of a call share a span ID.
   */
  public Span joinServerSpan(RequestContext context, String name, TraceContext incoming) {
    if (incoming == null) throw new NullPointerException("incoming == null");
    return serverSpan(context, name, incoming);
  }

  Span serverSpan(RequestContext context, String name, TraceContext traceContext) {
    if (context == null) throw new NullPointerException("context == null");
    if (name == null) throw new NullPointerException("name == null");
    if (context.parent != null) {
      throw new IllegalArgumentException("context is not the root scope of a request");
    }
    if (context.span != null) {
      throw new IllegalArgumentException("context is already bound to " + context.span);
    }
    Span span = new Span(this, Span.Kind.SERVER, traceContext, context, name);
    context.span(span);
    for (ServerSpanObserver observer : observers) {
      observer.onServerSpanCreated(context, span);
    }
    return span;
  }

  /**
   * Makes the request context of the given span current until the result is closed. Closing the
   * result does not finish the span.
   *
   * @param span span whose request context to place into scope or null to clear the scope
   */
  public SpanInScope withSpanInScope(@Nullable Span span) {
    return new SpanInScope(
      currentRequestContext.newScope(span != null ? span.requestContext() : null));
  }

  /** Returns the span of the current request context or null if there isn't one. */
  @Nullable public Span currentSpan() {
    RequestContext current = currentRequestContext.get();
    return current != null ? current.span() : null;
  }

  /** A span remains in the scope it was bound to until close is called. */
  public static final class SpanInScope implements Closeable {
    final Scope scope;

    // This type hides the SPI type and allows us to double-check the SPI didn't return null.
    SpanInScope(Scope scope) {
      if (scope == null) throw new NullPointerException("scope == null");
      this.scope = scope;
    }

    /** No exceptions are thrown when unbinding a span scope. */
    @Override public void close() {
      scope.close();
    }

    @Override public String toString() {
      return scope.toString();
    }
  }

  /** Generates a new 64-bit ID, taking care to dodge zero which can be confused with absent */
  long nextId() {
    long nextId = 0L;
    while (nextId == 0L) {
      nextId = Platform.get().randomLong();
    }
    return nextId;
  }

  @Override public String toString() {
    Span currentSpan = currentSpan();
    return "Tracer{"
      + (currentSpan != null ? ("currentSpan=" + currentSpan + ", ") : "")
      + "observers=" + Arrays.toString(observers)
      + "}";
  }
}
