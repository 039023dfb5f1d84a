/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package spanscope;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class SpanTest {
  long timestamp = 1000L;
  SpanScope spanScope = SpanScope.newBuilder().clock(() -> timestamp).build();
  RequestContext context = RequestContext.create();
  Span span = spanScope.tracer().newServerSpan(context, "S1");
  SpanObserver observer = mock(SpanObserver.class);

  @AfterEach void close() {
    spanScope.close();
  }

  @Test void serverSpan() {
    assertThat(span.kind()).isEqualTo(Span.Kind.SERVER);
    assertThat(span.name()).isEqualTo("S1");
    assertThat(span.requestContext()).isSameAs(context);
    assertThat(span.context().parentId()).isNull();
  }

  @Test void newLocalChild() {
    Span child = span.newLocalChild("L1");

    assertThat(child.kind()).isEqualTo(Span.Kind.LOCAL);
    assertThat(child.context().traceId()).isEqualTo(span.context().traceId());
    assertThat(child.context().parentId()).isEqualTo(span.context().spanId());
    assertThat(child.context().spanId()).isNotEqualTo(span.context().spanId());
    assertThat(child.requestContext().parent()).isSameAs(context);
    assertThat(child.requestContext().span()).isSameAs(child);
  }

  @Test void newRemoteChild_sharesRequestContext() {
    Span child = span.newRemoteChild("R1");

    assertThat(child.kind()).isEqualTo(Span.Kind.REMOTE);
    assertThat(child.requestContext()).isSameAs(context);
    assertThat(child.context().parentId()).isEqualTo(span.context().spanId());
  }

  @Test void newChild_serverKindRejected() {
    assertThatThrownBy(() -> span.newChild("S2", Span.Kind.SERVER))
      .isInstanceOf(IllegalArgumentException.class);
  }

  @Test void newChild_notifiesObserversOnce() {
    span.register(observer);

    Span child = span.newLocalChild("L1");

    verify(observer).onChildSpanCreated(child);
  }

  @Test void newChild_observersNotInherited() {
    span.register(observer);
    Span child = span.newLocalChild("L1");

    Span grandchild = child.newLocalChild("L2");

    verify(observer, never()).onChildSpanCreated(grandchild);
  }

  @Test void newChild_observerMayRegisterMore() {
    List<String> seen = new ArrayList<>();
    span.register(new SpanObserver() {
      @Override public void onChildSpanCreated(Span child) {
        seen.add("first " + child.name());
        span.register(new SpanObserver() {
          @Override public void onChildSpanCreated(Span child) {
            seen.add("second " + child.name());
          }
        });
      }
    });

    span.newLocalChild("L1");
    span.newLocalChild("L2");

    assertThat(seen).containsExactly("first L1", "first L2", "second L2");
  }

  @Test void lifecycle_notifiesInOrder() {
    span.register(observer);

    span.start();
    span.tag("http.path", "/users");
    span.annotate("wr");
    span.finish();

    InOrder order = inOrder(observer);
    order.verify(observer).onStart(span);
    order.verify(observer).onTag(span, "http.path", "/users");
    order.verify(observer).onAnnotate(span, 1000L, "wr");
    order.verify(observer).onFinish(span);
  }

  @Test void recordsData() {
    span.start(1L);
    span.tag("http.path", "/users");
    span.annotate(2L, "wr");
    IllegalStateException error = new IllegalStateException();
    span.error(error);
    span.finish(3L);

    assertThat(span.startTimestamp()).isEqualTo(1L);
    assertThat(span.finishTimestamp()).isEqualTo(3L);
    assertThat(span.tags()).containsExactly(entry("http.path", "/users"));
    assertThat(span.annotations()).extracting(Map.Entry::getValue).containsExactly("wr");
    assertThat(span.error()).isSameAs(error);
    assertThat(span.isFinished()).isTrue();
  }

  @Test void finish_discardsObservers() {
    span.register(observer);
    span.finish();

    span.newLocalChild("L1");
    span.finish();

    verify(observer).onFinish(span);
    verify(observer, never()).onChildSpanCreated(any(Span.class));
  }

  @Test void finish_ignoresDataAfterwards() {
    span.finish();

    span.tag("late", "true");
    span.annotate("late");

    assertThat(span.tags()).isEmpty();
    assertThat(span.annotations()).isEmpty();
  }

  @Test void name_rename() {
    span.name("get /users");

    assertThat(span.name()).isEqualTo("get /users");
  }

  @Test void rejectsNulls() {
    assertThatThrownBy(() -> span.register(null))
      .isInstanceOf(NullPointerException.class)
      .hasMessage("observer == null");
    assertThatThrownBy(() -> span.tag("key", null))
      .isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> span.newChild("L1", null))
      .isInstanceOf(NullPointerException.class)
      .hasMessage("kind == null");
  }
}
