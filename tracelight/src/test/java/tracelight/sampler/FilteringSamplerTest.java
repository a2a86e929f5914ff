/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelight.sampler;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.trace.samplers.Sampler;
import io.opentelemetry.sdk.trace.samplers.SamplingDecision;
import io.opentelemetry.sdk.trace.samplers.SamplingResult;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static tracelight.processor.DropAttributeSpanProcessor.DROP;
import static tracelight.sampler.FilteringSampler.CLOUD_TRACE_BATCH_WRITE_SPANS;

@ExtendWith(MockitoExtension.class)
class FilteringSamplerTest {
  static final String TRACE_ID = "0af7651916cd43dd8448eb211c80319c";

  @Mock Sampler delegate;

  @Test void dropsCloudTraceExportRpc_regardlessOfDelegate() {
    FilteringSampler sampler = FilteringSampler.create(Sampler.alwaysOn());

    assertThat(sample(sampler, CLOUD_TRACE_BATCH_WRITE_SPANS, Attributes.empty()).getDecision())
      .isEqualTo(SamplingDecision.DROP);
  }

  @Test void dropsCloudTraceExportRpc_withoutConsultingDelegate() {
    FilteringSampler sampler = FilteringSampler.create(delegate);

    SamplingResult result = sample(sampler, CLOUD_TRACE_BATCH_WRITE_SPANS,
      Attributes.of(DROP, false));

    assertThat(result.getDecision()).isEqualTo(SamplingDecision.DROP);
    verifyNoInteractions(delegate);
  }

  @ParameterizedTest @EnumSource(SamplingDecision.class)
  void otherNames_returnDelegateDecisionUnchanged(SamplingDecision decision) {
    SamplingResult delegated = SamplingResult.create(decision);
    when(delegate.shouldSample(any(), anyString(), anyString(), any(), any(), anyList()))
      .thenReturn(delegated);

    assertThat(sample(FilteringSampler.create(delegate), "GET /users", Attributes.empty()))
      .isSameAs(delegated);
  }

  @ParameterizedTest
  @ValueSource(strings = {
    "google.devtools.cloudtrace.v2.TraceService/BatchWriteSpans/",
    " google.devtools.cloudtrace.v2.TraceService/BatchWriteSpans",
    "GOOGLE.DEVTOOLS.CLOUDTRACE.V2.TRACESERVICE/BATCHWRITESPANS",
    "google.devtools.cloudtrace.v2.TraceService",
    ""
  })
  void onlyExactNameMatchesAreDropped(String name) {
    FilteringSampler sampler = FilteringSampler.create(Sampler.alwaysOn());

    assertThat(sample(sampler, name, Attributes.empty()).getDecision())
      .isEqualTo(SamplingDecision.RECORD_AND_SAMPLE);
  }

  /** The drop attribute is checked when the span ends, not when it starts. */
  @Test void dropAttributeAtStart_isLeftToTheProcessor() {
    FilteringSampler sampler = FilteringSampler.create(Sampler.alwaysOn());

    assertThat(sample(sampler, "test-span", Attributes.of(DROP, true)).getDecision())
      .isEqualTo(SamplingDecision.RECORD_AND_SAMPLE);
  }

  @Test void dropFalse_isIgnored() {
    FilteringSampler sampler = FilteringSampler.create(Sampler.alwaysOn());

    assertThat(sample(sampler, "test-span", Attributes.of(DROP, false)).getDecision())
      .isEqualTo(SamplingDecision.RECORD_AND_SAMPLE);
  }

  @Test void neverUpgradesDelegateDrop() {
    FilteringSampler sampler = FilteringSampler.create(Sampler.alwaysOff());

    assertThat(sample(sampler, "test-span", Attributes.empty()).getDecision())
      .isEqualTo(SamplingDecision.DROP);
  }

  @Test void customNames() {
    FilteringSampler sampler = FilteringSampler.create(Sampler.alwaysOn(),
      Arrays.asList(FilteringSampler.OTLP_EXPORT, "healthz"));

    assertThat(sample(sampler, FilteringSampler.OTLP_EXPORT, Attributes.empty()).getDecision())
      .isEqualTo(SamplingDecision.DROP);
    assertThat(sample(sampler, "healthz", Attributes.empty()).getDecision())
      .isEqualTo(SamplingDecision.DROP);
    assertThat(sample(sampler, CLOUD_TRACE_BATCH_WRITE_SPANS, Attributes.empty()).getDecision())
      .isEqualTo(SamplingDecision.RECORD_AND_SAMPLE);
  }

  @Test void customNames_areCopied() {
    List<String> names = new ArrayList<>(Collections.singletonList("a"));
    FilteringSampler sampler = FilteringSampler.create(Sampler.alwaysOn(), names);

    names.add("b");

    assertThat(sampler.droppedSpanNames()).containsExactly("a");
  }

  @Test void description_wrapsDelegate() {
    assertThat(FilteringSampler.create(Sampler.alwaysOn()).getDescription())
      .isEqualTo("FilteringSampler{AlwaysOnSampler}");
  }

  @Test void create_rejectsNulls() {
    assertThatThrownBy(() -> FilteringSampler.create(null))
      .isInstanceOf(NullPointerException.class)
      .hasMessage("delegate == null");
    assertThatThrownBy(() -> FilteringSampler.create(Sampler.alwaysOn(), null))
      .isInstanceOf(NullPointerException.class)
      .hasMessage("droppedSpanNames == null");
    assertThatThrownBy(
      () -> FilteringSampler.create(Sampler.alwaysOn(), Collections.singletonList(null)))
      .isInstanceOf(NullPointerException.class);
  }

  static SamplingResult sample(Sampler sampler, String name, Attributes attributes) {
    return sampler.shouldSample(Context.root(), TRACE_ID, name, SpanKind.INTERNAL, attributes,
      Collections.emptyList());
  }
}
