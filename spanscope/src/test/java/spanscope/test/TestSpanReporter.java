/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package spanscope.test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import zipkin2.Span;
import zipkin2.reporter.Reporter;

public final class TestSpanReporter implements Reporter<Span>, Iterable<Span> {
  final List<Span> spans = new ArrayList<>();

  public Span get(int i) {
    return spans.get(i);
  }

  public List<Span> spans() {
    return spans;
  }

  @Override public void report(Span span) {
    spans.add(span);
  }

  @Override public Iterator<Span> iterator() {
    return spans.iterator();
  }

  public void clear() {
    spans.clear();
  }

  @Override public String toString() {
    return "TestSpanReporter{" + spans + "}";
  }
}
