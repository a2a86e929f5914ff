/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelight;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.baggage.propagation.W3CBaggagePropagator;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.SpanProcessor;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.opentelemetry.sdk.trace.samplers.Sampler;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;
import tracelight.TracingInitializationException.Stage;
import tracelight.exporter.ExporterKind;
import tracelight.exporter.SpanExporterFactory;
import tracelight.exporter.SpanExporters;
import tracelight.internal.Nullable;
import tracelight.processor.DropAttributeSpanProcessor;
import tracelight.sampler.FilteringSampler;

/**
 * A running trace pipeline: propagation, resource, sampler, processors and exporter.
 *
 * <p>Spans flow as follows: the {@link FilteringSampler} decides at start, then on end the {@link
 * DropAttributeSpanProcessor} withholds spans marked {@code drop=true}, then a batch processor
 * hands the rest to the exporter selected by {@link ExporterKind}.
 *
 * <p>Initialize once at process start, before serving traffic, and {@linkplain #shutdown(Duration)
 * shut down} once at process exit:
 * <pre>{@code
 * Tracing tracing = Tracing.initialize("checkout");
 * Runtime.getRuntime().addShutdownHook(new Thread(tracing::close));
 * }</pre>
 *
 * <p>Tests and embedders should prefer {@link #newBuilder()} with {@link
 * Builder#registerGlobal(boolean) registerGlobal(false)}, and pass the instance where needed.
 */
public final class Tracing implements Closeable {
  public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

  static final Logger LOG = Logger.getLogger(Tracing.class.getName());
  static final AtomicReference<Tracing> CURRENT = new AtomicReference<>();

  /**
   * Configures tracing from the process environment, registers it as the process-wide {@link
   * GlobalOpenTelemetry} and returns it.
   *
   * @see TracingConfig#fromEnvironment()
   */
  public static Tracing initialize(String serviceName) throws TracingInitializationException {
    return newBuilder()
      .serviceName(serviceName)
      .config(TracingConfig.fromEnvironment())
      .registerGlobal(true)
      .build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Returns the most recently registered instance if it hasn't been shut down, otherwise null.
   *
   * <p>This object should not be cached.
   */
  @Nullable public static Tracing current() {
    return CURRENT.get();
  }

  final OpenTelemetrySdk sdk;
  final Resource resource;
  final Sampler sampler;
  final ExporterKind exporterKind;
  final ShutdownCallbacks shutdownCallbacks;

  Tracing(OpenTelemetrySdk sdk, Resource resource, Sampler sampler, ExporterKind exporterKind,
    ShutdownCallbacks shutdownCallbacks) {
    this.sdk = sdk;
    this.resource = resource;
    this.sampler = sampler;
    this.exporterKind = exporterKind;
    this.shutdownCallbacks = shutdownCallbacks;
  }

  public OpenTelemetry openTelemetry() {
    return sdk;
  }

  /** W3C trace context plus W3C baggage. */
  public ContextPropagators propagators() {
    return sdk.getPropagators();
  }

  public Resource resource() {
    return resource;
  }

  public Sampler sampler() {
    return sampler;
  }

  public ExporterKind exporterKind() {
    return exporterKind;
  }

  /**
   * Returns a tracer from this pipeline. Callers name their spans explicitly, for example after
   * the method or RPC they wrap.
   */
  public Tracer tracer(String instrumentationScopeName) {
    if (instrumentationScopeName == null) {
      throw new NullPointerException("instrumentationScopeName == null");
    }
    return sdk.getTracer(instrumentationScopeName);
  }

  /**
   * Exports any batched spans, waiting up to the timeout. Returns false if that didn't complete
   * successfully in time.
   */
  public boolean flush(Duration timeout) {
    if (timeout == null) throw new NullPointerException("timeout == null");
    return sdk.getSdkTracerProvider().forceFlush()
      .join(timeout.toMillis(), TimeUnit.MILLISECONDS)
      .isSuccess();
  }

  /**
   * Flushes pending spans and releases the exporter. Every shutdown step runs even if an earlier
   * one fails. Calling this again is a no-op.
   *
   * @param timeout passed to each shutdown step
   * @throws TracingShutdownException holding the failure of each step that failed
   */
  public void shutdown(Duration timeout) throws TracingShutdownException {
    CURRENT.compareAndSet(this, null);
    shutdownCallbacks.shutdown(timeout);
  }

  /** Shuts down with {@link #DEFAULT_SHUTDOWN_TIMEOUT}, rethrowing any failure unchecked. */
  @Override public void close() {
    try {
      shutdown(DEFAULT_SHUTDOWN_TIMEOUT);
    } catch (TracingShutdownException e) {
      throw new IllegalStateException(e.getMessage(), e);
    }
  }

  @Override public String toString() {
    return "Tracing{exporterKind=" + exporterKind + ", sampler=" + sampler.getDescription() + "}";
  }

  public static final class Builder {
    String serviceName;
    ExporterKind exporterKind = ExporterKind.GCP;
    String otlpEndpoint = SpanExporters.DEFAULT_OTLP_ENDPOINT;
    double samplingRatio = TracingConfig.DEFAULT_SAMPLING_RATIO;
    Attributes resourceAttributes = Attributes.empty();
    Set<String> droppedSpanNames =
      new LinkedHashSet<>(Collections.singleton(FilteringSampler.CLOUD_TRACE_BATCH_WRITE_SPANS));
    SpanExporterFactory spanExporterFactory = SpanExporterFactory.DEFAULT;
    Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
    boolean registerGlobal;

    Builder() {
    }

    /** Required. Becomes the resource attribute {@code service.name}. */
    public Builder serviceName(String serviceName) {
      if (serviceName == null) throw new NullPointerException("serviceName == null");
      this.serviceName = serviceName;
      return this;
    }

    /** Copies exporter, endpoint, sampling and resource settings. */
    public Builder config(TracingConfig config) {
      if (config == null) throw new NullPointerException("config == null");
      this.exporterKind = config.exporterKind();
      this.otlpEndpoint = config.otlpEndpoint();
      this.samplingRatio = config.samplingRatio();
      this.resourceAttributes = config.resourceAttributes();
      return this;
    }

    /** Defaults to {@link ExporterKind#GCP}. */
    public Builder exporterKind(ExporterKind exporterKind) {
      if (exporterKind == null) throw new NullPointerException("exporterKind == null");
      this.exporterKind = exporterKind;
      return this;
    }

    /** Defaults to {@value SpanExporters#DEFAULT_OTLP_ENDPOINT}. */
    public Builder otlpEndpoint(String otlpEndpoint) {
      if (otlpEndpoint == null) throw new NullPointerException("otlpEndpoint == null");
      this.otlpEndpoint = otlpEndpoint;
      return this;
    }

    /**
     * Probability in [0, 1] that a new trace root is sampled. Children follow their parent's
     * decision. Defaults to 1.0.
     */
    public Builder samplingRatio(double samplingRatio) {
      if (!(samplingRatio >= 0.0 && samplingRatio <= 1.0)) {
        throw new IllegalArgumentException(
          "samplingRatio should be between 0 and 1: " + samplingRatio);
      }
      this.samplingRatio = samplingRatio;
      return this;
    }

    public Builder resourceAttributes(Attributes resourceAttributes) {
      if (resourceAttributes == null) throw new NullPointerException("resourceAttributes == null");
      this.resourceAttributes = resourceAttributes;
      return this;
    }

    /**
     * Span names never sampled. Defaults to {@link FilteringSampler#CLOUD_TRACE_BATCH_WRITE_SPANS}.
     */
    public Builder droppedSpanNames(Collection<String> droppedSpanNames) {
      if (droppedSpanNames == null) throw new NullPointerException("droppedSpanNames == null");
      this.droppedSpanNames = new LinkedHashSet<>(droppedSpanNames);
      return this;
    }

    /** Overrides how exporters are constructed, for example to export to memory in tests. */
    public Builder spanExporterFactory(SpanExporterFactory spanExporterFactory) {
      if (spanExporterFactory == null) {
        throw new NullPointerException("spanExporterFactory == null");
      }
      this.spanExporterFactory = spanExporterFactory;
      return this;
    }

    /** Bounds cleanup when {@link #build()} fails part way. */
    public Builder shutdownTimeout(Duration shutdownTimeout) {
      if (shutdownTimeout == null) throw new NullPointerException("shutdownTimeout == null");
      this.shutdownTimeout = shutdownTimeout;
      return this;
    }

    /**
     * When true, the result becomes {@link GlobalOpenTelemetry} and {@link Tracing#current()}, so
     * that code without a reference to it can create spans. Defaults to false.
     */
    public Builder registerGlobal(boolean registerGlobal) {
      this.registerGlobal = registerGlobal;
      return this;
    }

    /**
     * Assembles the pipeline. On failure, anything already constructed is shut down before the
     * exception is thrown.
     */
    public Tracing build() throws TracingInitializationException {
      if (serviceName == null) throw new NullPointerException("serviceName == null");

      ContextPropagators propagators = ContextPropagators.create(TextMapPropagator.composite(
        W3CTraceContextPropagator.getInstance(), W3CBaggagePropagator.getInstance()));

      Resource resource;
      try {
        resource = TracingResources.create(serviceName, resourceAttributes);
      } catch (RuntimeException e) {
        throw new TracingInitializationException(Stage.RESOURCE, "failed to create resource", e);
      }

      ShutdownCallbacks shutdownCallbacks = new ShutdownCallbacks();
      SpanExporter exporter;
      try {
        exporter = spanExporterFactory.create(exporterKind, otlpEndpoint);
        if (exporter == null) {
          throw new NullPointerException(spanExporterFactory + " returned null");
        }
      } catch (IOException | RuntimeException e) {
        TracingInitializationException failure = new TracingInitializationException(Stage.EXPORTER,
          "failed to create trace exporter " + exporterKind.configName(), e);
        shutdownQuietly(shutdownCallbacks, failure);
        throw failure;
      }
      ShutdownCallback exporterShutdown = ShutdownCallback.of("span exporter", exporter::shutdown);
      shutdownCallbacks.register(exporterShutdown);

      SpanProcessor processor =
        DropAttributeSpanProcessor.create(BatchSpanProcessor.builder(exporter).build());
      Sampler sampler = FilteringSampler.create(
        Sampler.parentBased(Sampler.traceIdRatioBased(samplingRatio)), droppedSpanNames);
      SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
        .addSpanProcessor(processor)
        .setResource(resource)
        .setSampler(sampler)
        .build();

      // Deliberately the reverse of construction order: the provider flushes its last batch into
      // the exporter, so it has to shut down first.
      shutdownCallbacks = new ShutdownCallbacks()
        .register(ShutdownCallback.of("tracer provider", tracerProvider::shutdown))
        .register(exporterShutdown);

      OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
        .setTracerProvider(tracerProvider)
        .setPropagators(propagators)
        .build();
      Tracing result = new Tracing(sdk, resource, sampler, exporterKind, shutdownCallbacks);
      if (registerGlobal) {
        try {
          GlobalOpenTelemetry.set(sdk);
        } catch (IllegalStateException e) {
          TracingInitializationException failure = new TracingInitializationException(
            Stage.REGISTRATION, "tracing was already initialized in this process", e);
          shutdownQuietly(shutdownCallbacks, failure);
          throw failure;
        }
        CURRENT.set(result);
      }
      LOG.fine(() -> "initialized " + result + " for service " + serviceName);
      return result;
    }

    void shutdownQuietly(ShutdownCallbacks callbacks, TracingInitializationException failure) {
      try {
        callbacks.shutdown(shutdownTimeout);
      } catch (TracingShutdownException e) {
        for (Throwable t : e.failures()) failure.addSuppressed(t);
      }
    }
  }
}
