/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelight.processor;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.ReadWriteSpan;
import io.opentelemetry.sdk.trace.ReadableSpan;
import io.opentelemetry.sdk.trace.SpanProcessor;

/**
 * Withholds finished spans tagged {@code drop=true} from the next processor, so they are never
 * batched or exported.
 *
 * <p>Name-based filtering happens before a span exists, in {@link
 * tracelight.sampler.FilteringSampler}. This handles the other case: only the code running inside
 * the span knows whether it was interesting. For example, a poll that found no work can call
 * {@link #drop(Span)} before ending the span.
 *
 * <p>The span is still recorded in memory, and its children are unaffected. Each child needs its
 * own attribute to be dropped.
 *
 * <p>This holds no state besides the delegate: {@link #shutdown()} and {@link #forceFlush()}
 * return the delegate's result.
 */
public final class DropAttributeSpanProcessor implements SpanProcessor {
  /** When {@code true} at span end, the span isn't exported. Absent or {@code false} is ignored. */
  public static final AttributeKey<Boolean> DROP = AttributeKey.booleanKey("drop");

  public static DropAttributeSpanProcessor create(SpanProcessor delegate) {
    if (delegate == null) throw new NullPointerException("delegate == null");
    return new DropAttributeSpanProcessor(delegate);
  }

  /** Marks the span so that it won't be exported when it ends. */
  public static void drop(Span span) {
    if (span == null) throw new NullPointerException("span == null");
    span.setAttribute(DROP, true);
  }

  final SpanProcessor delegate;

  DropAttributeSpanProcessor(SpanProcessor delegate) {
    this.delegate = delegate;
  }

  @Override public void onStart(Context parentContext, ReadWriteSpan span) {
    delegate.onStart(parentContext, span);
  }

  @Override public boolean isStartRequired() {
    return delegate.isStartRequired();
  }

  @Override public void onEnd(ReadableSpan span) {
    if (Boolean.TRUE.equals(span.getAttribute(DROP))) return;
    delegate.onEnd(span);
  }

  /** Always true, as the attribute can only be checked at the end. */
  @Override public boolean isEndRequired() {
    return true;
  }

  @Override public CompletableResultCode shutdown() {
    return delegate.shutdown();
  }

  @Override public CompletableResultCode forceFlush() {
    return delegate.forceFlush();
  }

  @Override public String toString() {
    return "DropAttributeSpanProcessor{" + delegate + "}";
  }
}
