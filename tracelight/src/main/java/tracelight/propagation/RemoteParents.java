/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelight.propagation;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.TraceFlags;
import io.opentelemetry.api.trace.TraceId;
import io.opentelemetry.api.trace.TraceState;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.trace.IdGenerator;
import tracelight.internal.Nullable;

/**
 * Continues a trace whose ID arrived out of band, such as in a message payload or a job record,
 * instead of in propagation headers.
 */
public final class RemoteParents {
  /**
   * Returns a context whose parent is a sampled remote span in the given trace, so that spans
   * started in it join that trace. The parent's span ID is random, as only the trace ID is known.
   *
   * <p>If the trace ID isn't 32 lowercase hex characters, or is all zeros, the input context is
   * returned unchanged and new spans start a new trace.
   */
  public static Context withRemoteParent(Context context, @Nullable String traceIdHex) {
    if (context == null) throw new NullPointerException("context == null");
    if (traceIdHex == null || !TraceId.isValid(traceIdHex)) return context;
    SpanContext parent = SpanContext.createFromRemoteParent(
      traceIdHex,
      IdGenerator.random().generateSpanId(),
      TraceFlags.getSampled(),
      TraceState.getDefault()
    );
    return context.with(Span.wrap(parent));
  }

  RemoteParents() {
  }
}
