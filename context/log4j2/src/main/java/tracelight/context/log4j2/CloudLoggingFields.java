/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelight.context.log4j2;

/**
 * Structured log field names that Google Cloud Logging recognizes. Other log pipelines can match on
 * them as well.
 *
 * @see <a href="https://cloud.google.com/logging/docs/structured-logging">Structured logging</a>
 */
public final class CloudLoggingFields {
  /** Lowercase hex trace ID, or {@code projects/<id>/traces/<hex>} when a project is known. */
  public static final String TRACE = "logging.googleapis.com/trace";
  /** Lowercase hex span ID. */
  public static final String SPAN_ID = "logging.googleapis.com/spanId";
  /** Boolean: true when the trace is sampled. */
  public static final String TRACE_SAMPLED = "logging.googleapis.com/trace_sampled";

  CloudLoggingFields() {
  }
}
