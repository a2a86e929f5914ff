/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelight.exporter;

import java.util.Locale;
import java.util.logging.Logger;
import tracelight.internal.Nullable;

/** Backends selectable with {@code OTEL_TRACES_EXPORTER}. */
public enum ExporterKind {
  /** Google Cloud Trace. This is the default. */
  GCP("gcp"),
  /** OTLP to a local collector, such as the AWS Distro for OpenTelemetry, forwarding to X-Ray. */
  AWS("aws", "xray"),
  /** OTLP directly to {@code OTEL_EXPORTER_OTLP_ENDPOINT}. */
  OTLP("otlp"),
  /** Human-readable, one span per line, for local development. */
  CONSOLE("console", "stdout"),
  /** Accepts and discards every span. */
  NONE("none", "noop");

  static final Logger LOG = Logger.getLogger(ExporterKind.class.getName());

  final String[] names;

  ExporterKind(String... names) {
    this.names = names;
  }

  /** The primary configuration value, such as "gcp". */
  public String configName() {
    return names[0];
  }

  /**
   * Parses a configuration value, ignoring case and surrounding whitespace. Null or blank returns
   * {@link #GCP}. An unrecognized value logs a warning and also returns {@link #GCP}, as a typo in
   * configuration shouldn't prevent startup.
   */
  public static ExporterKind resolve(@Nullable String value) {
    if (value == null) return GCP;
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if (normalized.isEmpty()) return GCP;
    for (ExporterKind kind : values()) {
      for (String name : kind.names) {
        if (name.equals(normalized)) return kind;
      }
    }
    LOG.warning("unknown trace exporter \"" + value + "\", defaulting to " + GCP.configName());
    return GCP;
  }
}
