/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package spanscope;

import io.micrometer.core.instrument.MeterRegistry;
import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import spanscope.context.ContextAttribute;
import spanscope.context.ContextFactory;
import spanscope.context.ContextObserver;
import spanscope.handler.ZipkinSpanObserver;
import spanscope.internal.Nullable;
import spanscope.internal.Platform;
import spanscope.propagation.CurrentRequestContext;
import spanscope.propagation.ThreadLocalCurrentRequestContext;
import zipkin2.reporter.Reporter;

/**
 * This wires request tracing to the request context. For example, a {@link Tracer}, and the
 * objects each request gets attached.
 *
 * <p>Everything is registered once, at startup:
 * <pre>{@code
 * spanScope = SpanScope.newBuilder()
 *                      .localServiceName("my-service")
 *                      .addToContext(DB, new DatabaseContextFactory(dataSource))
 *                      .addToContext("cache", new CacheContextFactory(memcached))
 *                      .spanReporter(reporter)
 *                      .build();
 * }</pre>
 *
 * <p>Instances built via {@link #newBuilder()} are registered automatically such that code without
 * a reference to this, like {@link ContextAttribute#getValue()}, can use {@link #current()}.
 */
public abstract class SpanScope implements Closeable {
  static final AtomicReference<SpanScope> CURRENT = new AtomicReference<>();

  public static Builder newBuilder() {
    return new Builder();
  }

  /** All requests start with a server span. Use a tracer to create them. */
  public abstract Tracer tracer();

  /** This supports in-process propagation of the request context, such as across threads. */
  public abstract CurrentRequestContext currentRequestContext();

  /** Returns the bindings registered via {@link Builder#addToContext}, in registration order. */
  public abstract List<ContextAttribute<?>> contextAttributes();

  /**
   * Passes the registry to {@link ContextFactory#reportRuntimeMetrics(MeterRegistry)} of each
   * registered factory, in registration order. This is intended to be called periodically.
   * Exceptions raised by a factory propagate, skipping those after it.
   */
  public abstract void reportRuntimeMetrics(MeterRegistry registry);

  /**
   * Returns the most recently created instance iff it hasn't been closed. null otherwise.
   *
   * <p>This object should not be cached.
   */
  @Nullable public static SpanScope current() {
    return CURRENT.get();
  }

  /**
   * Returns the most recently created tracer if its component hasn't been closed. null otherwise.
   *
   * <p>This object should not be cached.
   */
  @Nullable public static Tracer currentTracer() {
    SpanScope spanScope = current();
    return spanScope != null ? spanScope.tracer() : null;
  }

  /** Ensures this component can be garbage collected, by making it not {@link #current()} */
  @Override public abstract void close();

  public static final class Builder {
    String localServiceName = "unknown";
    @Nullable Clock clock;
    CurrentRequestContext currentRequestContext = ThreadLocalCurrentRequestContext.create();
    final Set<ServerSpanObserver> observers = new LinkedHashSet<>(); // dupes not ok
    final Map<String, ContextObserver<?>> contextObservers = new LinkedHashMap<>();
    @Nullable Reporter<zipkin2.Span> spanReporter;

    Builder() {
    }

    /**
     * Label of this service in the service graph, such as "favstar". Avoid names with variables or
     * unique identifiers embedded. Defaults to "unknown".
     */
    public Builder localServiceName(String localServiceName) {
      if (localServiceName == null || localServiceName.isEmpty()) {
        throw new IllegalArgumentException(localServiceName + " is not a valid serviceName");
      }
      this.localServiceName = localServiceName;
      return this;
    }

    /**
     * Assigns microsecond-resolution timestamp source for operations like {@link Span#start()}.
     * Defaults to JRE-specific platform time.
     */
    public Builder clock(Clock clock) {
      if (clock == null) throw new NullPointerException("clock == null");
      this.clock = clock;
      return this;
    }

    /**
     * Responsible for implementing {@link Tracer#withSpanInScope(Span)}, {@link
     * Tracer#currentSpan()} and {@link ContextAttribute#getValue()}.
     *
     * <p>By default a static thread-local is used.
     */
    public Builder currentRequestContext(CurrentRequestContext currentRequestContext) {
      if (currentRequestContext == null) {
        throw new NullPointerException("currentRequestContext == null");
      }
      this.currentRequestContext = currentRequestContext;
      return this;
    }

    /**
     * Adds an observer notified when each request's server span is created. Observers are notified
     * in the order added, which includes those added by {@link #addToContext}.
     *
     * @param observer skipped if already added
     */
    public Builder addObserver(ServerSpanObserver observer) {
      if (observer == null) throw new NullPointerException("observer == null");
      if (!observers.add(observer)) {
        Platform.get().log("Please check configuration as {0} was added twice", observer, null);
      }
      return this;
    }

    /**
     * Attaches the object the factory makes to the request context of every request under the
     * attribute's name. Local child spans of the server span get their own object, visible only
     * under them.
     *
     * @throws IllegalArgumentException if a factory is already registered under the same name
     */
    public <T> Builder addToContext(ContextAttribute<T> attribute,
      ContextFactory<? extends T> contextFactory) {
      if (attribute == null) throw new NullPointerException("attribute == null");
      if (contextFactory == null) throw new NullPointerException("contextFactory == null");
      if (contextObservers.containsKey(attribute.name())) {
        throw new IllegalArgumentException(
          "A context factory is already registered under " + attribute.name());
      }
      ContextObserver<T> observer = new ContextObserver<>(attribute, contextFactory);
      contextObservers.put(attribute.name(), observer);
      return addObserver(observer);
    }

    /**
     * Like {@link #addToContext(ContextAttribute, ContextFactory)}, except read via {@link
     * RequestContext#get(String)}.
     */
    public Builder addToContext(String name, ContextFactory<?> contextFactory) {
      return addToContext(ContextAttribute.create(name, Object.class), contextFactory);
    }

    /**
     * Reports every span to Zipkin once it finishes. Errors raised by the reporter are logged, not
     * propagated. The reporting observer is notified after those {@linkplain #addObserver added}.
     *
     * @param spanReporter skipped if {@link Reporter#NOOP}
     */
    public Builder spanReporter(Reporter<zipkin2.Span> spanReporter) {
      if (spanReporter == null) throw new NullPointerException("spanReporter == null");
      if (spanReporter == Reporter.NOOP) return this;
      this.spanReporter = spanReporter;
      return this;
    }

    public SpanScope build() {
      return new Default(this);
    }
  }

  static final class Default extends SpanScope {
    final Tracer tracer;
    final CurrentRequestContext currentRequestContext;
    final List<ContextAttribute<?>> contextAttributes;
    final List<ContextFactory<?>> contextFactories;

    Default(Builder builder) {
      Clock clock = builder.clock != null ? builder.clock : Platform.get().clock();
      this.currentRequestContext = builder.currentRequestContext;

      List<ServerSpanObserver> observers = new ArrayList<>(builder.observers);
      // reporting is last, so that it sees the result of other observers
      if (builder.spanReporter != null) {
        observers.add(new ZipkinSpanObserver(builder.spanReporter, builder.localServiceName,
          Platform.get().linkLocalIp()));
      }

      List<ContextAttribute<?>> contextAttributes = new ArrayList<>();
      List<ContextFactory<?>> contextFactories = new ArrayList<>();
      for (ContextObserver<?> observer : builder.contextObservers.values()) {
        contextAttributes.add(observer.attribute());
        contextFactories.add(observer.contextFactory());
      }
      this.contextAttributes = Collections.unmodifiableList(contextAttributes);
      this.contextFactories = contextFactories;

      this.tracer = new Tracer(clock, observers.toArray(new ServerSpanObserver[0]),
        currentRequestContext);
      maybeSetCurrent();
    }

    @Override public Tracer tracer() {
      return tracer;
    }

    @Override public CurrentRequestContext currentRequestContext() {
      return currentRequestContext;
    }

    @Override public List<ContextAttribute<?>> contextAttributes() {
      return contextAttributes;
    }

    @Override public void reportRuntimeMetrics(MeterRegistry registry) {
      if (registry == null) throw new NullPointerException("registry == null");
      for (ContextFactory<?> contextFactory : contextFactories) {
        contextFactory.reportRuntimeMetrics(registry);
      }
    }

    private void maybeSetCurrent() {
      if (CURRENT.get() != null) return;
      CURRENT.compareAndSet(null, this);
    }

    @Override public String toString() {
      return tracer.toString();
    }

    @Override public void close() {
      // only set null if we are the outermost instance
      CURRENT.compareAndSet(this, null);
    }
  }

  SpanScope() { // intentionally hidden constructor
  }
}
