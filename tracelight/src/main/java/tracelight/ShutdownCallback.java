/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelight;

import io.opentelemetry.sdk.common.CompletableResultCode;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Releases a resource owned by one pipeline component, such as an exporter's connection pool.
 *
 * <p>Implementations should return within the given timeout. One that ignores it delays the
 * process exit, but doesn't prevent other callbacks from running.
 */
@FunctionalInterface
public interface ShutdownCallback {
  void shutdown(Duration timeout) throws Exception;

  /**
   * Adapts an asynchronous OpenTelemetry shutdown, such as {@code exporter::shutdown}, waiting up
   * to the timeout for it to complete.
   */
  static ShutdownCallback of(String component, Supplier<CompletableResultCode> shutdown) {
    if (component == null) throw new NullPointerException("component == null");
    if (shutdown == null) throw new NullPointerException("shutdown == null");
    return timeout -> {
      CompletableResultCode result =
        shutdown.get().join(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (!result.isDone()) {
        throw new IllegalStateException(component + " didn't shut down within " + timeout);
      }
      if (!result.isSuccess()) {
        throw new IllegalStateException(component + " failed to shut down");
      }
    };
  }
}
