/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package spanscope;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import spanscope.internal.Nullable;
import spanscope.internal.Platform;
import spanscope.propagation.TraceContext;

/**
 * Used to model the latency of an operation within a request.
 *
 * <p>Spans form a tree rooted at a {@linkplain Kind#SERVER server span}, created by {@link
 * Tracer#newServerSpan(RequestContext, String)}. Children are created from their parent:
 * <pre>{@code
 * Span child = span.newLocalChild("encode").start();
 * try {
 *   return encoder.encode(child.requestContext());
 * } catch (RuntimeException | Error e) {
 *   child.error(e);
 *   throw e;
 * } finally {
 *   child.finish();
 * }
 * }</pre>
 *
 * <p>Note: All methods return {@linkplain Span} for chaining, but the instance is always the same.
 * This type is not thread safe.
 */
public final class Span {
  public enum Kind {
    /** The root of a request's span tree, representing the inbound request. */
    SERVER,
    /**
     * In-process work, such as a traced function call. Gets its own {@linkplain
     * RequestContext#newChild() scope} of the request context.
     */
    LOCAL,
    /**
     * An outbound call over the network. Shares the request context of its parent, as objects
     * attached for the parent remain valid across the network boundary.
     */
    REMOTE
  }

  final Tracer tracer;
  final Kind kind;
  final TraceContext context;
  final RequestContext requestContext;
  final List<SpanObserver> observers = new ArrayList<>();
  final Map<String, String> tags = new LinkedHashMap<>();
  final List<Map.Entry<Long, String>> annotations = new ArrayList<>();
  String name;
  long startTimestamp, finishTimestamp;
  @Nullable Throwable error;
  boolean finished;

  Span(Tracer tracer, Kind kind, TraceContext context, RequestContext requestContext, String name) {
    this.tracer = tracer;
    this.kind = kind;
    this.context = context;
    this.requestContext = requestContext;
    this.name = name;
  }

  /** Discriminates in-process work from the request itself and from outbound calls. */
  public Kind kind() {
    return kind;
  }

  public TraceContext context() {
    return context;
  }

  /**
   * Returns the context code running under this span should read from. For a {@link Kind#REMOTE}
   * span, this is the same instance as the parent's.
   */
  public RequestContext requestContext() {
    return requestContext;
  }

  public String name() {
    return name;
  }

  /** Renames the span, for example once a route is known. */
  public Span name(String name) {
    if (name == null) throw new NullPointerException("name == null");
    this.name = name;
    return this;
  }

  /**
   * Adds an observer notified of this span's lifecycle until it finishes.
   *
   * @see ServerSpanObserver
   */
  public Span register(SpanObserver observer) {
    if (observer == null) throw new NullPointerException("observer == null");
    observers.add(observer);
    return this;
  }

  /** Starts the span with an implicit timestamp. */
  public Span start() {
    return start(tracer.clock.currentTimeMicroseconds());
  }

  /** Like {@link #start()}, except with a given timestamp in microseconds. */
  public Span start(long timestamp) {
    startTimestamp = timestamp;
    for (SpanObserver observer : snapshot()) {
      observer.onStart(this);
    }
    return this;
  }

  public Span tag(String key, String value) {
    if (key == null) throw new NullPointerException("key == null");
    if (key.isEmpty()) throw new IllegalArgumentException("key is empty");
    if (value == null) throw new NullPointerException("value == null");
    if (finished) return logIgnored("tag");
    tags.put(key, value);
    for (SpanObserver observer : snapshot()) {
      observer.onTag(this, key, value);
    }
    return this;
  }

  public Span annotate(String value) {
    return annotate(tracer.clock.currentTimeMicroseconds(), value);
  }

  /** Like {@link #annotate(String)}, except with a given timestamp in microseconds. */
  public Span annotate(long timestamp, String value) {
    if (value == null) throw new NullPointerException("value == null");
    if (finished) return logIgnored("annotate");
    annotations.add(new SimpleImmutableEntry<>(timestamp, value));
    for (SpanObserver observer : snapshot()) {
      observer.onAnnotate(this, timestamp, value);
    }
    return this;
  }

  /** Records the error, visible to observers via {@link #error()} when the span finishes. */
  public Span error(Throwable error) {
    if (error == null) throw new NullPointerException("error == null");
    this.error = error;
    return this;
  }

  /** Returns a new child representing in-process work, with its own request context scope. */
  public Span newLocalChild(String name) {
    return newChild(name, Kind.LOCAL);
  }

  /** Returns a new child representing an outbound call, sharing this span's request context. */
  public Span newRemoteChild(String name) {
    return newChild(name, Kind.REMOTE);
  }

  /**
   * Creates a child span of the given kind, then notifies each of this span's observers via {@link
   * SpanObserver#onChildSpanCreated(Span)} before returning it.
   *
   * <p>Exceptions raised by observers propagate, in which case the child is not returned.
   *
   * @param kind {@link Kind#LOCAL} or {@link Kind#REMOTE}. Server spans are only created by the
   * {@link Tracer}.
   */
  public Span newChild(String name, Kind kind) {
    if (name == null) throw new NullPointerException("name == null");
    if (kind == null) throw new NullPointerException("kind == null");
    if (kind == Kind.SERVER) {
      throw new IllegalArgumentException("server spans cannot be children; use Tracer");
    }
    TraceContext childContext = TraceContext.newBuilder()
      .traceId(context.traceId())
      .parentId(context.spanId())
      .spanId(tracer.nextId())
      .build();
    RequestContext childRequestContext =
      kind == Kind.LOCAL ? requestContext.newChild() : requestContext;
    Span child = new Span(tracer, kind, childContext, childRequestContext, name);
    if (kind == Kind.LOCAL) childRequestContext.span(child);
    for (SpanObserver observer : snapshot()) {
      observer.onChildSpanCreated(child);
    }
    return child;
  }

  /** Reports the span complete, assigning the most precise duration possible. */
  public void finish() {
    finish(tracer.clock.currentTimeMicroseconds());
  }

  /**
   * Like {@link #finish()}, except with a given timestamp in microseconds.
   *
   * <p>Observers are notified, then discarded. Subsequent calls are ignored.
   */
  public void finish(long timestamp) {
    if (finished) {
      logIgnored("finish");
      return;
    }
    finished = true;
    finishTimestamp = timestamp;
    SpanObserver[] toNotify = snapshot();
    observers.clear();
    for (SpanObserver observer : toNotify) {
      observer.onFinish(this);
    }
  }

  public boolean isFinished() {
    return finished;
  }

  /** Epoch microseconds of the start of this span or zero if not started. */
  public long startTimestamp() {
    return startTimestamp;
  }

  /** Epoch microseconds of the end of this span or zero if not finished. */
  public long finishTimestamp() {
    return finishTimestamp;
  }

  /** Returns an immutable view of the tags, in insertion order. */
  public Map<String, String> tags() {
    return Collections.unmodifiableMap(tags);
  }

  /** Returns an immutable view of (epoch microseconds, value) pairs, in insertion order. */
  public Collection<Map.Entry<Long, String>> annotations() {
    return Collections.unmodifiableList(annotations);
  }

  @Nullable public Throwable error() {
    return error;
  }

  SpanObserver[] snapshot() {
    return observers.toArray(new SpanObserver[0]);
  }

  Span logIgnored(String operation) {
    Platform.get().log("ignoring " + operation + " on finished span {0}", context, null);
    return this;
  }

  @Override public String toString() {
    return "Span{" + kind + ", " + name + ", " + context + "}";
  }
}
