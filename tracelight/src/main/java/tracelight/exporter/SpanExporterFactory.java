/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelight.exporter;

import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.io.IOException;

/**
 * Constructs the exporter for a resolved backend. Once constructed, callers only use the {@link
 * SpanExporter} contract: export a batch, flush and shut down.
 *
 * @see SpanExporters#create(ExporterKind, String)
 */
@FunctionalInterface
public interface SpanExporterFactory {
  SpanExporterFactory DEFAULT = SpanExporters::create;

  /**
   * @param kind the resolved backend
   * @param otlpEndpoint base URL of the OTLP/HTTP collector, used by {@link ExporterKind#AWS} and
   * {@link ExporterKind#OTLP}.
   * @throws IOException when the backend cannot be reached or credentials cannot be loaded
   */
  SpanExporter create(ExporterKind kind, String otlpEndpoint) throws IOException;
}
