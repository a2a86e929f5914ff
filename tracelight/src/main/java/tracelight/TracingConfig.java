/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelight;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import java.util.Map;
import java.util.logging.Logger;
import tracelight.exporter.ExporterKind;
import tracelight.exporter.SpanExporters;
import tracelight.internal.Nullable;

/**
 * Settings read from the process environment. Malformed values never fail startup: they are
 * replaced by defaults and a warning is logged.
 */
public final class TracingConfig {
  public static final String OTEL_TRACES_EXPORTER = "OTEL_TRACES_EXPORTER";
  public static final String OTEL_EXPORTER_OTLP_ENDPOINT = "OTEL_EXPORTER_OTLP_ENDPOINT";
  public static final String OTEL_TRACES_SAMPLER_ARG = "OTEL_TRACES_SAMPLER_ARG";
  public static final String OTEL_RESOURCE_ATTRIBUTES = "OTEL_RESOURCE_ATTRIBUTES";

  /** Sample everything not explicitly filtered. */
  public static final double DEFAULT_SAMPLING_RATIO = 1.0;

  static final Logger LOG = Logger.getLogger(TracingConfig.class.getName());

  public static TracingConfig fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  public static TracingConfig fromEnvironment(Map<String, String> env) {
    if (env == null) throw new NullPointerException("env == null");
    ExporterKind exporterKind = ExporterKind.resolve(env.get(OTEL_TRACES_EXPORTER));
    String endpoint = env.get(OTEL_EXPORTER_OTLP_ENDPOINT);
    if (endpoint == null || endpoint.trim().isEmpty()) {
      endpoint = SpanExporters.DEFAULT_OTLP_ENDPOINT;
    }
    double ratio = parseSamplingRatio(env.get(OTEL_TRACES_SAMPLER_ARG));
    Attributes resourceAttributes = parseResourceAttributes(env.get(OTEL_RESOURCE_ATTRIBUTES));
    return new TracingConfig(exporterKind, endpoint.trim(), ratio, resourceAttributes);
  }

  final ExporterKind exporterKind;
  final String otlpEndpoint;
  final double samplingRatio;
  final Attributes resourceAttributes;

  TracingConfig(ExporterKind exporterKind, String otlpEndpoint, double samplingRatio,
    Attributes resourceAttributes) {
    this.exporterKind = exporterKind;
    this.otlpEndpoint = otlpEndpoint;
    this.samplingRatio = samplingRatio;
    this.resourceAttributes = resourceAttributes;
  }

  public ExporterKind exporterKind() {
    return exporterKind;
  }

  public String otlpEndpoint() {
    return otlpEndpoint;
  }

  public double samplingRatio() {
    return samplingRatio;
  }

  /** Attributes from {@value #OTEL_RESOURCE_ATTRIBUTES}, possibly empty. */
  public Attributes resourceAttributes() {
    return resourceAttributes;
  }

  static double parseSamplingRatio(@Nullable String value) {
    if (value == null || value.trim().isEmpty()) return DEFAULT_SAMPLING_RATIO;
    double ratio;
    try {
      ratio = Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      ratio = Double.NaN;
    }
    if (ratio >= 0.0 && ratio <= 1.0) return ratio; // NaN fails both comparisons
    LOG.warning("invalid " + OTEL_TRACES_SAMPLER_ARG + " \"" + value + "\", defaulting to "
      + DEFAULT_SAMPLING_RATIO);
    return DEFAULT_SAMPLING_RATIO;
  }

  /** Parses the W3C baggage-like format "key1=value1,key2=value2". */
  static Attributes parseResourceAttributes(@Nullable String value) {
    if (value == null || value.trim().isEmpty()) return Attributes.empty();
    AttributesBuilder result = Attributes.builder();
    for (String entry : value.split(",")) {
      if (entry.trim().isEmpty()) continue;
      int eq = entry.indexOf('=');
      String key = eq > 0 ? entry.substring(0, eq).trim() : "";
      if (key.isEmpty()) {
        LOG.warning("skipping malformed " + OTEL_RESOURCE_ATTRIBUTES + " entry \"" + entry + "\"");
        continue;
      }
      result.put(key, entry.substring(eq + 1).trim());
    }
    return result.build();
  }

  @Override public String toString() {
    return "TracingConfig{exporterKind=" + exporterKind
      + ", otlpEndpoint=" + otlpEndpoint
      + ", samplingRatio=" + samplingRatio
      + ", resourceAttributes=" + resourceAttributes + "}";
  }
}
