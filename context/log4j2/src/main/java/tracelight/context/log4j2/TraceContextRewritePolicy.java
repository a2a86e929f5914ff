/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelight.context.log4j2;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.apache.logging.log4j.core.Core;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.appender.rewrite.RewritePolicy;
import org.apache.logging.log4j.core.config.plugins.Plugin;
import org.apache.logging.log4j.core.config.plugins.PluginAttribute;
import org.apache.logging.log4j.core.config.plugins.PluginFactory;
import org.apache.logging.log4j.core.impl.Log4jLogEvent;
import org.apache.logging.log4j.util.SortedArrayStringMap;

/**
 * Adds the {@linkplain Span#current() current span's} IDs to each log event's context data, as
 * {@link CloudLoggingFields#TRACE}, {@link CloudLoggingFields#SPAN_ID} and {@link
 * CloudLoggingFields#TRACE_SAMPLED}. Events logged outside a valid span pass through unchanged.
 *
 * <p>Use it in a {@code Rewrite} appender in front of the real one, so that every logger is
 * covered, including child loggers and those with extra {@link
 * org.apache.logging.log4j.ThreadContext} fields:
 * <pre>{@code
 * <Rewrite name="Traced">
 *   <AppenderRef ref="Console"/>
 *   <TraceContextRewritePolicy projectId="my-project"/>
 * </Rewrite>
 * }</pre>
 *
 * <p>{@link LoggingSetup} does this programmatically.
 */
@Plugin(name = "TraceContextRewritePolicy", category = Core.CATEGORY_NAME,
  elementType = "rewritePolicy", printObject = true)
public final class TraceContextRewritePolicy implements RewritePolicy {
  static final TraceContextRewritePolicy INSTANCE = new TraceContextRewritePolicy(null);

  /** Writes the trace field as bare hex. */
  public static TraceContextRewritePolicy get() {
    return INSTANCE;
  }

  /**
   * @param projectId when set, the trace field is written as
   * {@code projects/<projectId>/traces/<hex>}, the form Cloud Logging uses to link to Cloud Trace.
   */
  @PluginFactory
  public static TraceContextRewritePolicy create(@PluginAttribute("projectId") String projectId) {
    if (projectId == null || projectId.trim().isEmpty()) return INSTANCE;
    return new TraceContextRewritePolicy(projectId.trim());
  }

  final String tracePrefix;

  TraceContextRewritePolicy(String projectId) {
    this.tracePrefix = projectId != null ? "projects/" + projectId + "/traces/" : "";
  }

  @Override public LogEvent rewrite(LogEvent source) {
    SpanContext context = Span.current().getSpanContext();
    if (!context.isValid()) return source;

    SortedArrayStringMap contextData = new SortedArrayStringMap(source.getContextData());
    contextData.putValue(CloudLoggingFields.TRACE, tracePrefix + context.getTraceId());
    contextData.putValue(CloudLoggingFields.SPAN_ID, context.getSpanId());
    contextData.putValue(CloudLoggingFields.TRACE_SAMPLED, context.isSampled());
    return new Log4jLogEvent.Builder(source).setContextData(contextData).build();
  }

  @Override public String toString() {
    return tracePrefix.isEmpty()
      ? "TraceContextRewritePolicy{}"
      : "TraceContextRewritePolicy{tracePrefix=" + tracePrefix + "}";
  }
}
