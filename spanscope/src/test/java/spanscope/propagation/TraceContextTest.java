/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package spanscope.propagation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TraceContextTest {
  TraceContext context = TraceContext.newBuilder().traceId(333L).parentId(1L).spanId(3L).build();

  @Test void idStrings() {
    assertThat(context.traceIdString()).isEqualTo("000000000000014d");
    assertThat(context.parentIdString()).isEqualTo("0000000000000001");
    assertThat(context.spanIdString()).isEqualTo("0000000000000003");
    assertThat(context).hasToString("000000000000014d/0000000000000003");
  }

  @Test void parentId_absent() {
    TraceContext root = context.toBuilder().parentId(0L).build();

    assertThat(root.parentId()).isNull();
    assertThat(root.parentIdAsLong()).isZero();
    assertThat(root.parentIdString()).isNull();
  }

  @Test void parentId_nullable() {
    assertThat(context.toBuilder().parentId((Long) null).build().parentId()).isNull();
  }

  @Test void equals_ignoresParent() {
    TraceContext reparented = context.toBuilder().parentId(2L).build();

    assertThat(context).isEqualTo(reparented);
    assertThat(context).hasSameHashCodeAs(reparented);
    assertThat(context).isNotEqualTo(context.toBuilder().spanId(4L).build());
  }

  @Test void build_requiresIds() {
    assertThatThrownBy(() -> TraceContext.newBuilder().build())
      .isInstanceOf(IllegalStateException.class)
      .hasMessage("Missing: traceId spanId");
  }
}
