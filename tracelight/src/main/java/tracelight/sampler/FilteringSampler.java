/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelight.sampler;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.trace.data.LinkData;
import io.opentelemetry.sdk.trace.samplers.Sampler;
import io.opentelemetry.sdk.trace.samplers.SamplingResult;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Drops spans whose name is on a deny list, and otherwise returns the decision of a delegate
 * sampler unchanged. This never upgrades a decision.
 *
 * <p>The main use is breaking the feedback loop where the exporter's own RPC would be traced and
 * exported, which in turn creates another export RPC. For example, the Google Cloud Trace exporter
 * calls {@value #CLOUD_TRACE_BATCH_WRITE_SPANS}.
 *
 * <p>Only the span name is considered. A {@code drop} attribute present at start time is left to
 * {@link tracelight.processor.DropAttributeSpanProcessor}, which checks it when the span ends.
 *
 * <p>Ex.
 * <pre>{@code
 * tracerProvider = SdkTracerProvider.builder()
 *                    .setSampler(FilteringSampler.create(Sampler.parentBased(Sampler.alwaysOn())))
 *                    ...
 *                    .build();
 * }</pre>
 */
public final class FilteringSampler implements Sampler {
  /** The span name of the Google Cloud Trace export RPC. */
  public static final String CLOUD_TRACE_BATCH_WRITE_SPANS =
    "google.devtools.cloudtrace.v2.TraceService/BatchWriteSpans";

  /** The span name of the OTLP gRPC export RPC. */
  public static final String OTLP_EXPORT =
    "opentelemetry.proto.collector.trace.v1.TraceService/Export";

  /** Drops {@link #CLOUD_TRACE_BATCH_WRITE_SPANS} and defers everything else to the delegate. */
  public static FilteringSampler create(Sampler delegate) {
    return create(delegate, Collections.singleton(CLOUD_TRACE_BATCH_WRITE_SPANS));
  }

  /**
   * Drops spans whose name exactly equals one of the given names.
   *
   * @param delegate decides for all spans not dropped by name
   * @param droppedSpanNames exact span names to drop. Matching is case-sensitive.
   */
  public static FilteringSampler create(Sampler delegate, Collection<String> droppedSpanNames) {
    if (delegate == null) throw new NullPointerException("delegate == null");
    if (droppedSpanNames == null) throw new NullPointerException("droppedSpanNames == null");
    Set<String> copy = new LinkedHashSet<>();
    for (String name : droppedSpanNames) {
      if (name == null) throw new NullPointerException("droppedSpanNames contains null");
      copy.add(name);
    }
    return new FilteringSampler(delegate, Collections.unmodifiableSet(copy));
  }

  final Sampler delegate;
  final Set<String> droppedSpanNames;

  FilteringSampler(Sampler delegate, Set<String> droppedSpanNames) {
    this.delegate = delegate;
    this.droppedSpanNames = droppedSpanNames;
  }

  public Sampler delegate() {
    return delegate;
  }

  public Set<String> droppedSpanNames() {
    return droppedSpanNames;
  }

  @Override public SamplingResult shouldSample(Context parentContext, String traceId, String name,
    SpanKind spanKind, Attributes attributes, List<LinkData> parentLinks) {
    if (droppedSpanNames.contains(name)) return SamplingResult.drop();
    return delegate.shouldSample(parentContext, traceId, name, spanKind, attributes, parentLinks);
  }

  @Override public String getDescription() {
    return "FilteringSampler{" + delegate.getDescription() + "}";
  }

  @Override public String toString() {
    return getDescription();
  }
}
