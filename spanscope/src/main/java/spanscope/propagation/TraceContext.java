/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package spanscope.propagation;

import spanscope.internal.Nullable;

/**
 * Identifiers of a span within a trace. Zero means absent for {@link #parentId()} and invalid for
 * the others.
 */
public final class TraceContext {
  public static Builder newBuilder() {
    return new Builder();
  }

  final long traceId, parentId, spanId;

  TraceContext(Builder builder) {
    this.traceId = builder.traceId;
    this.parentId = builder.parentId;
    this.spanId = builder.spanId;
  }

  /** Unique 8-byte identifier for a trace, set on all spans within it. */
  public long traceId() {
    return traceId;
  }

  /** The parent's {@link #spanId} or null if this the root span in a trace. */
  @Nullable public Long parentId() {
    return parentId != 0 ? parentId : null;
  }

  /** Like {@link #parentId()} except returns a primitive where zero implies absent. */
  public long parentIdAsLong() {
    return parentId;
  }

  /** Unique 8-byte identifier of this span within a trace. */
  public long spanId() {
    return spanId;
  }

  public String traceIdString() {
    return toLowerHex(traceId);
  }

  @Nullable public String parentIdString() {
    return parentId != 0 ? toLowerHex(parentId) : null;
  }

  public String spanIdString() {
    return toLowerHex(spanId);
  }

  public Builder toBuilder() {
    Builder result = new Builder();
    result.traceId = traceId;
    result.parentId = parentId;
    result.spanId = spanId;
    return result;
  }

  @Override public String toString() {
    return traceIdString() + "/" + spanIdString();
  }

  /** Only considers identifiers, as the parent is implied by them. */
  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof TraceContext)) return false;
    TraceContext that = (TraceContext) o;
    return traceId == that.traceId && spanId == that.spanId;
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= (int) ((traceId >>> 32) ^ traceId);
    h *= 1000003;
    h ^= (int) ((spanId >>> 32) ^ spanId);
    return h;
  }

  static String toLowerHex(long v) {
    String hex = Long.toHexString(v);
    if (hex.length() == 16) return hex;
    StringBuilder result = new StringBuilder(16);
    for (int i = hex.length(); i < 16; i++) result.append('0');
    return result.append(hex).toString();
  }

  public static final class Builder {
    long traceId, parentId, spanId;

    /** @see TraceContext#traceId() */
    public Builder traceId(long traceId) {
      this.traceId = traceId;
      return this;
    }

    /** @see TraceContext#parentIdAsLong() */
    public Builder parentId(long parentId) {
      this.parentId = parentId;
      return this;
    }

    /** @see TraceContext#parentId() */
    public Builder parentId(@Nullable Long parentId) {
      this.parentId = parentId != null ? parentId : 0L;
      return this;
    }

    /** @see TraceContext#spanId() */
    public Builder spanId(long spanId) {
      this.spanId = spanId;
      return this;
    }

    public TraceContext build() {
      String missing = "";
      if (traceId == 0L) missing += " traceId";
      if (spanId == 0L) missing += " spanId";
      if (!"".equals(missing)) throw new IllegalStateException("Missing:" + missing);
      return new TraceContext(this);
    }

    Builder() { // no external implementations
    }
  }
}
