/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package spanscope.handler;

import java.util.Locale;
import java.util.Map;
import spanscope.RequestContext;
import spanscope.ServerSpanObserver;
import spanscope.Span;
import spanscope.SpanObserver;
import spanscope.SpanScope;
import spanscope.internal.Nullable;
import spanscope.internal.Platform;
import spanscope.propagation.TraceContext;
import zipkin2.Endpoint;
import zipkin2.reporter.Reporter;

import static spanscope.internal.Throwables.propagateIfFatal;

/**
 * Reports every span of a request to Zipkin once it finishes. The server span and all of its
 * descendants are followed, whatever their kind.
 *
 * <p>Logs exceptions instead of raising an error, as the supplied reporter could have bugs.
 *
 * @see SpanScope.Builder#spanReporter(Reporter)
 */
public final class ZipkinSpanObserver implements ServerSpanObserver {
  final Reporter<zipkin2.Span> spanReporter;
  final Endpoint localEndpoint;
  final ReportingSpanObserver reportingSpanObserver = new ReportingSpanObserver();

  /**
   * @param localServiceName lower-cased, as Zipkin does not support mixed case service names.
   * @param localIp IP of this host or null if unknown
   */
  public ZipkinSpanObserver(Reporter<zipkin2.Span> spanReporter, String localServiceName,
    @Nullable String localIp) {
    if (spanReporter == null) throw new NullPointerException("spanReporter == null");
    if (localServiceName == null) throw new NullPointerException("localServiceName == null");
    this.spanReporter = spanReporter;
    this.localEndpoint = Endpoint.newBuilder()
      .serviceName(localServiceName.toLowerCase(Locale.ROOT))
      .ip(localIp)
      .build();
  }

  @Override public void onServerSpanCreated(RequestContext context, Span serverSpan) {
    serverSpan.register(reportingSpanObserver);
  }

  final class ReportingSpanObserver extends SpanObserver {
    @Override public void onChildSpanCreated(Span child) {
      child.register(this);
    }

    @Override public void onFinish(Span span) {
      try {
        spanReporter.report(convert(span));
      } catch (Throwable t) {
        propagateIfFatal(t);
        Platform.get().log("error reporting {0}", span.context(), t);
      }
    }

    @Override public String toString() {
      return "ReportingSpanObserver{" + spanReporter + "}";
    }
  }

  zipkin2.Span convert(Span span) {
    TraceContext context = span.context();
    zipkin2.Span.Builder result = zipkin2.Span.newBuilder()
      .traceId(0L, context.traceId())
      .parentId(context.parentIdAsLong())
      .id(context.spanId())
      .name(span.name())
      .localEndpoint(localEndpoint);

    switch (span.kind()) {
      case SERVER:
        result.kind(zipkin2.Span.Kind.SERVER);
        break;
      case REMOTE:
        result.kind(zipkin2.Span.Kind.CLIENT);
        break;
      default:
        // local spans have no kind in Zipkin
    }

    long start = span.startTimestamp(), finish = span.finishTimestamp();
    if (start != 0L) {
      result.timestamp(start);
      if (finish != 0L) result.duration(Math.max(finish - start, 1));
    }

    for (Map.Entry<String, String> tag : span.tags().entrySet()) {
      result.putTag(tag.getKey(), tag.getValue());
    }
    Throwable error = span.error();
    if (error != null && !span.tags().containsKey("error")) {
      result.putTag("error", errorMessage(error));
    }
    for (Map.Entry<Long, String> annotation : span.annotations()) {
      result.addAnnotation(annotation.getKey(), annotation.getValue());
    }
    return result.build();
  }

  static String errorMessage(Throwable error) {
    String message = error.getMessage();
    if (message != null) return message;
    String simpleName = error.getClass().getSimpleName();
    // check empty as the class could be anonymous
    return simpleName.isEmpty() ? error.getClass().getName() : simpleName;
  }

  @Override public String toString() {
    return "ZipkinSpanObserver{" + spanReporter + "}";
  }
}
