/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package spanscope.propagation;

import java.io.Closeable;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import spanscope.RequestContext;
import spanscope.Tracer;
import spanscope.internal.Nullable;

/**
 * This makes a given request context current by placing it in scope (usually but not always a
 * thread local scope). This lets code that doesn't have a reference to the context, such as {@link
 * spanscope.context.ContextAttribute#getValue()}, read from it.
 *
 * <p>This type is an SPI, and intended to be used by implementors looking to change thread-local
 * storage.
 *
 * @see Tracer#withSpanInScope(spanscope.Span)
 */
public abstract class CurrentRequestContext {
  /** Returns the request context in scope or null if there isn't one. */
  public abstract @Nullable RequestContext get();

  /**
   * Sets the current request context in scope until the returned object is closed. It is a
   * programming error to drop or never close the result. Using try-with-resources is preferred for
   * this reason.
   *
   * @param current context to place into scope or null to clear the scope
   */
  public abstract Scope newScope(@Nullable RequestContext current);

  /**
   * Like {@link #newScope(RequestContext)}, except returns {@link Scope#NOOP} if the given context
   * is already in scope. This can reduce overhead when scoping callbacks.
   */
  public Scope maybeScope(@Nullable RequestContext current) {
    RequestContext currentScope = get();
    if (current == currentScope) return Scope.NOOP;
    return newScope(current);
  }

  /** A request context remains in the scope it was bound to until close is called. */
  public interface Scope extends Closeable {
    /**
     * Returned when {@link CurrentRequestContext#maybeScope(RequestContext)} detected scope
     * redundancy.
     */
    Scope NOOP = new Scope() {
      @Override public void close() {
      }

      @Override public String toString() {
        return "NoopScope";
      }
    };

    /** No exceptions are thrown when unbinding a scope. */
    @Override void close();
  }

  /**
   * Wraps the input so that it executes with the same context as now.
   *
   * <p>The wrapped task reads the same scope as the caller. If the task attaches objects of its
   * own, it should do so against a {@linkplain RequestContext#newChild() child scope}.
   */
  public <C> Callable<C> wrap(Callable<C> task) {
    final RequestContext invocationContext = get();
    class CurrentRequestContextCallable implements Callable<C> {
      @Override public C call() throws Exception {
        try (Scope scope = maybeScope(invocationContext)) {
          return task.call();
        }
      }
    }
    return new CurrentRequestContextCallable();
  }

  /** Wraps the input so that it executes with the same context as now. */
  public Runnable wrap(Runnable task) {
    final RequestContext invocationContext = get();
    class CurrentRequestContextRunnable implements Runnable {
      @Override public void run() {
        try (Scope scope = maybeScope(invocationContext)) {
          task.run();
        }
      }
    }
    return new CurrentRequestContextRunnable();
  }

  /**
   * Decorates the input such that the {@link #get() current request context} at the time a task is
   * scheduled is made current when the task is executed.
   */
  public Executor executor(Executor delegate) {
    class CurrentRequestContextExecutor implements Executor {
      @Override public void execute(Runnable task) {
        delegate.execute(CurrentRequestContext.this.wrap(task));
      }
    }
    return new CurrentRequestContextExecutor();
  }
}
