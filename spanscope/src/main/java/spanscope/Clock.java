/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package spanscope;

/**
 * Epoch microseconds used for {@link Span#start(long)}, {@link Span#finish(long)} and {@link
 * Span#annotate(long, String)}.
 *
 * <p>This should use the most precise value possible. For example, {@code gettimeofday} or
 * multiplying {@link System#currentTimeMillis} by 1000.
 *
 * <p><em>Note</em>: This type is safe to implement as a lambda, or use as a method reference as it
 * is effectively a {@code FunctionalInterface}.
 */
// Do not add methods as it will break lambda usage!
public interface Clock {

  long currentTimeMicroseconds();
}
