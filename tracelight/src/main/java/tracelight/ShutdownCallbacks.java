/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelight;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static tracelight.internal.Throwables.propagateIfFatal;

/**
 * Ordered set of cleanup callbacks registered as pipeline components are constructed.
 *
 * <p>{@link #shutdown(Duration)} runs every callback in registration order, even when an earlier
 * one fails, then forgets them. Calling it again is a no-op.
 */
public final class ShutdownCallbacks {
  static final Logger LOG = Logger.getLogger(ShutdownCallbacks.class.getName());

  final List<ShutdownCallback> callbacks = new ArrayList<>();

  public synchronized ShutdownCallbacks register(ShutdownCallback callback) {
    if (callback == null) throw new NullPointerException("callback == null");
    callbacks.add(callback);
    return this;
  }

  /** Returns the count of callbacks that haven't run yet. */
  public synchronized int size() {
    return callbacks.size();
  }

  /**
   * Runs and clears all callbacks, passing each the same timeout.
   *
   * @throws TracingShutdownException holding every failure, in registration order
   */
  public void shutdown(Duration timeout) throws TracingShutdownException {
    if (timeout == null) throw new NullPointerException("timeout == null");
    List<ShutdownCallback> toRun;
    synchronized (this) {
      toRun = new ArrayList<>(callbacks);
      callbacks.clear();
    }

    List<Throwable> failures = new ArrayList<>();
    for (ShutdownCallback callback : toRun) {
      try {
        callback.shutdown(timeout);
      } catch (Throwable t) {
        propagateIfFatal(t);
        if (t instanceof InterruptedException) Thread.currentThread().interrupt();
        LOG.log(Level.FINE, "shutdown callback failed", t);
        failures.add(t);
      }
    }
    if (!failures.isEmpty()) throw new TracingShutdownException(failures);
  }

  @Override public synchronized String toString() {
    return "ShutdownCallbacks{size=" + callbacks.size() + "}";
  }
}
