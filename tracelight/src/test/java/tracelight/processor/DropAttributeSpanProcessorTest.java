/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelight.processor;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.ReadWriteSpan;
import io.opentelemetry.sdk.trace.ReadableSpan;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.SpanProcessor;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static tracelight.processor.DropAttributeSpanProcessor.DROP;

@ExtendWith(MockitoExtension.class)
class DropAttributeSpanProcessorTest {
  @Mock SpanProcessor delegate;
  @Mock ReadableSpan readableSpan;
  @Mock ReadWriteSpan readWriteSpan;

  InMemorySpanExporter spans = InMemorySpanExporter.create();
  SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
    .addSpanProcessor(DropAttributeSpanProcessor.create(SimpleSpanProcessor.create(spans)))
    .build();
  Tracer tracer = tracerProvider.get("test");

  @AfterEach void close() {
    tracerProvider.close();
  }

  @Test void onEnd_dropTrue_isWithheld() {
    when(readableSpan.getAttribute(DROP)).thenReturn(true);

    DropAttributeSpanProcessor.create(delegate).onEnd(readableSpan);

    verify(delegate, never()).onEnd(readableSpan);
  }

  @Test void onEnd_dropFalse_isForwarded() {
    when(readableSpan.getAttribute(DROP)).thenReturn(false);

    DropAttributeSpanProcessor.create(delegate).onEnd(readableSpan);

    verify(delegate).onEnd(readableSpan);
  }

  @Test void onEnd_dropAbsent_isForwarded() {
    DropAttributeSpanProcessor.create(delegate).onEnd(readableSpan);

    verify(delegate).onEnd(readableSpan);
  }

  @Test void onStart_isForwarded() {
    Context parent = Context.root();

    DropAttributeSpanProcessor.create(delegate).onStart(parent, readWriteSpan);

    verify(delegate).onStart(parent, readWriteSpan);
  }

  @Test void isStartRequired_followsDelegate() {
    when(delegate.isStartRequired()).thenReturn(false);

    assertThat(DropAttributeSpanProcessor.create(delegate).isStartRequired()).isFalse();
  }

  @Test void isEndRequired_evenWhenDelegateIsNot() {
    assertThat(DropAttributeSpanProcessor.create(delegate).isEndRequired()).isTrue();
  }

  @Test void shutdownAndFlush_returnDelegateResult() {
    CompletableResultCode failed = CompletableResultCode.ofFailure();
    when(delegate.shutdown()).thenReturn(failed);
    when(delegate.forceFlush()).thenReturn(CompletableResultCode.ofSuccess());

    DropAttributeSpanProcessor processor = DropAttributeSpanProcessor.create(delegate);

    assertThat(processor.forceFlush().isSuccess()).isTrue();
    assertThat(processor.shutdown()).isSameAs(failed);
  }

  @Test void create_rejectsNull() {
    assertThatThrownBy(() -> DropAttributeSpanProcessor.create(null))
      .isInstanceOf(NullPointerException.class)
      .hasMessage("delegate == null");
  }

  @Test void markedSpan_isNotExported() {
    Span span = tracer.spanBuilder("empty-poll").startSpan();
    DropAttributeSpanProcessor.drop(span);
    span.end();

    tracer.spanBuilder("real-work").startSpan().end();

    assertThat(spans.getFinishedSpanItems())
      .extracting(SpanData::getName)
      .containsExactly("real-work");
  }

  @Test void dropAtStart_isNotExported() {
    tracer.spanBuilder("test-span").setAttribute(DROP, true).startSpan().end();

    assertThat(spans.getFinishedSpanItems()).isEmpty();
  }

  @Test void dropFalse_isExported() {
    tracer.spanBuilder("test-span").setAttribute(DROP, false).startSpan().end();

    assertThat(spans.getFinishedSpanItems())
      .extracting(SpanData::getName)
      .containsExactly("test-span");
  }

  @Test void dropReversedBeforeEnd_isExported() {
    Span span = tracer.spanBuilder("test-span").setAttribute(DROP, true).startSpan();
    span.setAttribute(DROP, false);
    span.end();

    assertThat(spans.getFinishedSpanItems()).hasSize(1);
  }

  @Test void droppedParent_doesNotDropChildren() {
    Span parent = tracer.spanBuilder("parent").startSpan();
    DropAttributeSpanProcessor.drop(parent);
    try (Scope scope = parent.makeCurrent()) {
      tracer.spanBuilder("child").startSpan().end();
    } finally {
      parent.end();
    }

    assertThat(spans.getFinishedSpanItems())
      .extracting(SpanData::getName)
      .containsExactly("child");
  }
}
