/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package spanscope.context;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import spanscope.RequestContext;
import spanscope.Span;
import spanscope.SpanScope;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContextFactoryTest {
  SpanScope spanScope = SpanScope.newBuilder().build();
  RequestContext context = RequestContext.create();
  Span serverSpan = spanScope.tracer().newServerSpan(context, "S1");

  static final class IncompleteFactory extends ContextFactory<Object> {
  }

  @AfterEach void close() {
    spanScope.close();
  }

  @Test void makeObjectForContext_notImplemented() {
    assertThatThrownBy(() -> new IncompleteFactory().makeObjectForContext("db", serverSpan))
      .isInstanceOf(UnsupportedOperationException.class)
      .hasMessageContaining("IncompleteFactory")
      .hasMessageContaining("makeObjectForContext");
  }

  @Test void makeObjectForContext_notImplemented_bindsNothing() {
    ContextObserver<Object> observer =
      new ContextObserver<>(ContextAttribute.create("db", Object.class), new IncompleteFactory());

    assertThatThrownBy(() -> observer.onServerSpanCreated(context, serverSpan))
      .isInstanceOf(UnsupportedOperationException.class);

    assertThat(context.contains("db")).isFalse();
  }

  @Test void reportRuntimeMetrics_defaultIsNoop() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();

    new IncompleteFactory().reportRuntimeMetrics(registry);

    assertThat(registry.getMeters()).isEmpty();
  }
}
