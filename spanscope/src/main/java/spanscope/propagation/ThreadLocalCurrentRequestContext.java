/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package spanscope.propagation;

import spanscope.RequestContext;
import spanscope.internal.Nullable;

/**
 * In-process request context propagation backed by a thread local.
 *
 * <p>By default, the thread local is static, so all {@link spanscope.SpanScope} instances see the
 * same current context. Use {@link Builder#separateThreadLocal()} for an isolated one, such as in
 * tests.
 */
public class ThreadLocalCurrentRequestContext extends CurrentRequestContext {
  public static CurrentRequestContext create() {
    return new Builder(DEFAULT).build();
  }

  public static Builder newBuilder() {
    return new Builder(DEFAULT);
  }

  /**
   * This component is backed by a possibly static shared thread local. Call this to clear the
   * reference when you are sure any residual state is due to a leak. This is generally only useful
   * in tests.
   */
  public void clear() {
    local.remove();
  }

  public static final class Builder {
    ThreadLocal<RequestContext> local;

    Builder(ThreadLocal<RequestContext> local) {
      this.local = local;
    }

    /** Use a thread local not shared with other instances. */
    public Builder separateThreadLocal() {
      this.local = new ThreadLocal<>();
      return this;
    }

    public ThreadLocalCurrentRequestContext build() {
      return new ThreadLocalCurrentRequestContext(this);
    }
  }

  static final ThreadLocal<RequestContext> DEFAULT = new ThreadLocal<>();

  @SuppressWarnings("ThreadLocalUsage") // intentional: to support multiple SpanScope instances
  final ThreadLocal<RequestContext> local;
  final RevertToNullScope revertToNull;

  ThreadLocalCurrentRequestContext(Builder builder) {
    if (builder.local == null) throw new NullPointerException("local == null");
    local = builder.local;
    revertToNull = new RevertToNullScope(local);
  }

  @Override public RequestContext get() {
    return local.get();
  }

  @Override public Scope newScope(@Nullable RequestContext current) {
    final RequestContext previous = local.get();
    local.set(current);
    return previous != null ? new RevertToPreviousScope(local, previous) : revertToNull;
  }

  static final class RevertToNullScope implements Scope {
    final ThreadLocal<RequestContext> local;

    RevertToNullScope(ThreadLocal<RequestContext> local) {
      this.local = local;
    }

    @Override public void close() {
      local.set(null);
    }
  }

  static final class RevertToPreviousScope implements Scope {
    final ThreadLocal<RequestContext> local;
    final RequestContext previous;

    RevertToPreviousScope(ThreadLocal<RequestContext> local, RequestContext previous) {
      this.local = local;
      this.previous = previous;
    }

    @Override public void close() {
      local.set(previous);
    }
  }
}
