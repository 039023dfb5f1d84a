/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package spanscope.context;

import spanscope.RequestContext;
import spanscope.SpanScope;
import spanscope.internal.Nullable;

/**
 * Typed accessor for an object attached to the {@link RequestContext} under a name.
 *
 * <p>Define one per binding, usually as a constant, and register it with a factory at startup:
 * <pre>{@code
 * static final ContextAttribute<Database> DB = ContextAttribute.create("db", Database.class);
 *
 * spanScope = SpanScope.newBuilder().addToContext(DB, databaseContextFactory).build();
 * }</pre>
 *
 * <p>Then, while serving a request:
 * <pre>{@code
 * Database db = DB.getValue(context);
 * }</pre>
 *
 * @param <T> type of the attached object
 */
public final class ContextAttribute<T> {
  /**
   * @param name non-empty name without whitespace, which is the key in the request context
   * @param type type attached objects are cast to on read
   */
  public static <T> ContextAttribute<T> create(String name, Class<T> type) {
    if (type == null) throw new NullPointerException("type == null");
    return new ContextAttribute<>(validateName(name), type);
  }

  final String name;
  final Class<T> type;

  ContextAttribute(String name, Class<T> type) {
    this.name = name;
    this.type = type;
  }

  public String name() {
    return name;
  }

  public Class<T> type() {
    return type;
  }

  /**
   * Returns the object attached in the innermost scope that has one, or null if unavailable.
   *
   * @throws ClassCastException if an object of a different type was attached under this name
   */
  @Nullable public T getValue(@Nullable RequestContext context) {
    if (context == null) return null;
    return type.cast(context.get(name));
  }

  /**
   * Like {@link #getValue(RequestContext)} except against the current request context.
   *
   * <p>Prefer {@link #getValue(RequestContext)} if you have a reference to the request context.
   */
  @Nullable public T getValue() {
    SpanScope spanScope = SpanScope.current();
    if (spanScope == null) return null;
    return getValue(spanScope.currentRequestContext().get());
  }

  /**
   * Attaches the value in the given scope, hiding any value attached by an enclosing scope.
   *
   * @see RequestContext#shadow(String, Object)
   */
  public void updateValue(RequestContext context, T value) {
    if (context == null) throw new NullPointerException("context == null");
    context.shadow(name, type.cast(value));
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof ContextAttribute)) return false;
    return name.equals(((ContextAttribute<?>) o).name);
  }

  @Override public int hashCode() {
    return name.hashCode();
  }

  @Override public String toString() {
    return "ContextAttribute{" + name + "}";
  }

  static String validateName(String name) {
    if (name == null) throw new NullPointerException("name == null");
    if (name.isEmpty()) throw new IllegalArgumentException("name is empty");
    for (int i = 0; i < name.length(); i++) {
      if (Character.isWhitespace(name.charAt(i))) {
        throw new IllegalArgumentException("name contains whitespace: " + name);
      }
    }
    return name;
  }
}
