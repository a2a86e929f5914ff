/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelight.exporter;

import com.google.cloud.opentelemetry.trace.TraceExporter;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.io.IOException;

/** Constructs the {@link SpanExporter} for an {@link ExporterKind}. */
public final class SpanExporters {
  /** Default base URL of an OTLP/HTTP collector, such as a sidecar. */
  public static final String DEFAULT_OTLP_ENDPOINT = "http://localhost:4318";

  static final String TRACES_PATH = "/v1/traces";

  /**
   * Returns a new exporter for the given backend. The caller owns the result and must {@linkplain
   * SpanExporter#shutdown() shut it down}.
   */
  public static SpanExporter create(ExporterKind kind, String otlpEndpoint) throws IOException {
    if (kind == null) throw new NullPointerException("kind == null");
    switch (kind) {
      case GCP:
        return TraceExporter.createWithDefaultConfiguration();
      case AWS:
      case OTLP:
        return OtlpHttpSpanExporter.builder().setEndpoint(tracesUrl(otlpEndpoint)).build();
      case CONSOLE:
        return LoggingSpanExporter.create();
      case NONE:
        return noop();
      default:
        throw new AssertionError("unhandled " + kind);
    }
  }

  /** Returns an exporter that accepts and discards every span. */
  public static SpanExporter noop() {
    return SpanExporter.composite();
  }

  /**
   * Appends the traces signal path to a base OTLP/HTTP endpoint, as done for {@code
   * OTEL_EXPORTER_OTLP_ENDPOINT}.
   */
  static String tracesUrl(String otlpEndpoint) {
    String base = otlpEndpoint == null || otlpEndpoint.trim().isEmpty()
      ? DEFAULT_OTLP_ENDPOINT
      : otlpEndpoint.trim();
    while (base.endsWith("/")) base = base.substring(0, base.length() - 1);
    if (base.endsWith(TRACES_PATH)) return base;
    return base + TRACES_PATH;
  }

  SpanExporters() {
  }
}
