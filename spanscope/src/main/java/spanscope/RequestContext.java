/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package spanscope;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import spanscope.context.ContextAttribute;
import spanscope.internal.Nullable;
import spanscope.internal.Platform;

/**
 * Request-scoped namespace carrying objects attached while a request is traced, such as client
 * handles tagged with the span they were made for.
 *
 * <p>Logically this is a stack of scopes. A {@linkplain #create() root scope} covers the whole
 * request. A {@link Span.Kind#LOCAL local span} gets a {@linkplain #newChild() child scope} chained
 * to its parent's. Reads resolve innermost-first, and writes only ever bind in the scope they are
 * called on:
 * <pre>{@code
 * RequestContext request = RequestContext.create();
 * request.set("db", serverDb);
 *
 * RequestContext local = request.newChild();
 * local.shadow("db", localDb);
 *
 * local.get("db");   // localDb
 * request.get("db"); // serverDb
 * }</pre>
 *
 * <p>Prefer a {@link ContextAttribute} over raw names, as it performs the cast for you.
 *
 * <p>This type is not thread safe. Scopes are expected to be entered and exited in a strictly
 * nested fashion on the thread processing the request. If a request forks work, each branch should
 * use its own {@linkplain #newChild() child scope}.
 */
public final class RequestContext {
  /** Returns a new root scope, covering one request. */
  public static RequestContext create() {
    return new RequestContext(null);
  }

  @Nullable final RequestContext parent;
  final Map<String, Object> attributes = new LinkedHashMap<>();
  @Nullable Span span;

  RequestContext(@Nullable RequestContext parent) {
    this.parent = parent;
  }

  /**
   * Returns a new scope whose reads fall back to this one. Bindings made in the result are
   * invisible here.
   */
  public RequestContext newChild() {
    return new RequestContext(this);
  }

  /** Returns the enclosing scope, or null if this is the root scope of the request. */
  @Nullable public RequestContext parent() {
    return parent;
  }

  /** Returns the span this scope was created for, or the nearest ancestor's span. */
  @Nullable public Span span() {
    for (RequestContext c = this; c != null; c = c.parent) {
      if (c.span != null) return c.span;
    }
    return null;
  }

  /** Binds the value under the given name in this scope, replacing any binding made here. */
  public void set(String name, Object value) {
    bind(name, value);
  }

  /**
   * Binds the value under the given name in this scope, hiding any binding an ancestor has for the
   * same name. Ancestors are not modified, so once this scope is no longer used, code reading from
   * an ancestor sees the ancestor's value.
   *
   * <p>On a root scope, this is the same as {@link #set(String, Object)}.
   */
  public void shadow(String name, Object value) {
    bind(name, value);
    if (parent != null && parent.contains(name)) {
      Platform.get().log("shadowing context attribute {0}", name, null);
    }
  }

  /** Returns the value bound to the name in the innermost scope that has one, or null. */
  @Nullable public Object get(String name) {
    if (name == null) throw new NullPointerException("name == null");
    for (RequestContext c = this; c != null; c = c.parent) {
      Object value = c.attributes.get(name);
      if (value != null) return value;
    }
    return null;
  }

  /** Returns true if {@link #get(String)} would return a value. */
  public boolean contains(String name) {
    return get(name) != null;
  }

  /** Returns the names visible from this scope, outermost bindings first. */
  public Set<String> names() {
    Set<String> result = new LinkedHashSet<>();
    if (parent != null) result.addAll(parent.names());
    result.addAll(attributes.keySet());
    return Collections.unmodifiableSet(result);
  }

  void span(Span span) {
    this.span = span;
  }

  void bind(String name, Object value) {
    if (name == null) throw new NullPointerException("name == null");
    if (name.isEmpty()) throw new IllegalArgumentException("name is empty");
    if (value == null) throw new NullPointerException("value of " + name + " == null");
    attributes.put(name, value);
  }

  @Override public String toString() {
    return "RequestContext{"
      + (span != null ? "span=" + span.context() + ", " : "")
      + "attributes=" + attributes.keySet()
      + (parent != null ? ", parent=" + parent : "")
      + "}";
  }
}
