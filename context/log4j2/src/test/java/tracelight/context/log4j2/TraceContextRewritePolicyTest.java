/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelight.context.log4j2;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.TraceFlags;
import io.opentelemetry.api.trace.TraceState;
import io.opentelemetry.context.Scope;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.impl.Log4jLogEvent;
import org.apache.logging.log4j.message.SimpleMessage;
import org.apache.logging.log4j.util.SortedArrayStringMap;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TraceContextRewritePolicyTest {
  static final String TRACE_ID = "01000000000000000000000000000000";
  static final String SPAN_ID = "0200000000000000";
  static final Span SAMPLED = Span.wrap(
    SpanContext.create(TRACE_ID, SPAN_ID, TraceFlags.getSampled(), TraceState.getDefault()));
  static final Span NOT_SAMPLED = Span.wrap(
    SpanContext.create(TRACE_ID, SPAN_ID, TraceFlags.getDefault(), TraceState.getDefault()));

  LogEvent event = Log4jLogEvent.newBuilder()
    .setLoggerName("test")
    .setLevel(Level.INFO)
    .setMessage(new SimpleMessage("hello"))
    .build();

  @Test void addsTraceFields() {
    LogEvent rewritten;
    try (Scope scope = SAMPLED.makeCurrent()) {
      rewritten = TraceContextRewritePolicy.get().rewrite(event);
    }

    assertThat(rewritten.getContextData().<Object>getValue(CloudLoggingFields.TRACE))
      .isEqualTo(TRACE_ID);
    assertThat(rewritten.getContextData().<Object>getValue(CloudLoggingFields.SPAN_ID))
      .isEqualTo(SPAN_ID);
    assertThat(rewritten.getContextData().<Object>getValue(CloudLoggingFields.TRACE_SAMPLED))
      .isEqualTo(true);
    assertThat(rewritten.getMessage().getFormattedMessage()).isEqualTo("hello");
  }

  @Test void sampledFlag_followsTraceFlags() {
    LogEvent rewritten;
    try (Scope scope = NOT_SAMPLED.makeCurrent()) {
      rewritten = TraceContextRewritePolicy.get().rewrite(event);
    }

    assertThat(rewritten.getContextData().<Object>getValue(CloudLoggingFields.TRACE_SAMPLED))
      .isEqualTo(false);
  }

  @Test void projectId_qualifiesTrace() {
    LogEvent rewritten;
    try (Scope scope = SAMPLED.makeCurrent()) {
      rewritten = TraceContextRewritePolicy.create("my-project").rewrite(event);
    }

    assertThat(rewritten.getContextData().<Object>getValue(CloudLoggingFields.TRACE))
      .isEqualTo("projects/my-project/traces/" + TRACE_ID);
  }

  @Test void blankProjectId_isBareHex() {
    assertThat(TraceContextRewritePolicy.create(" ")).isSameAs(TraceContextRewritePolicy.get());
    assertThat(TraceContextRewritePolicy.create(null)).isSameAs(TraceContextRewritePolicy.get());
  }

  @Test void keepsExistingContextData() {
    SortedArrayStringMap contextData = new SortedArrayStringMap();
    contextData.putValue("request", "r1");
    LogEvent withData = new Log4jLogEvent.Builder(event).setContextData(contextData).build();

    LogEvent rewritten;
    try (Scope scope = SAMPLED.makeCurrent()) {
      rewritten = TraceContextRewritePolicy.get().rewrite(withData);
    }

    assertThat(rewritten.getContextData().<Object>getValue("request")).isEqualTo("r1");
    assertThat(rewritten.getContextData().size()).isEqualTo(4);
    assertThat(withData.getContextData().size()).isEqualTo(1);
  }

  @Test void noSpan_returnsEventUnchanged() {
    assertThat(TraceContextRewritePolicy.get().rewrite(event)).isSameAs(event);
  }

  @Test void invalidSpan_returnsEventUnchanged() {
    try (Scope scope = Span.getInvalid().makeCurrent()) {
      assertThat(TraceContextRewritePolicy.get().rewrite(event)).isSameAs(event);
    }
  }
}
