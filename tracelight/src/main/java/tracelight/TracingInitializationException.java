/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelight;

/**
 * Raised when the tracing pipeline could not be assembled. Anything already constructed was shut
 * down before this was thrown: failures doing so are {@linkplain #getSuppressed() suppressed}.
 *
 * <p>Callers decide whether to abort startup or continue without tracing.
 */
public final class TracingInitializationException extends Exception {
  static final long serialVersionUID = 0L;

  /** Which step of initialization failed. */
  public enum Stage {
    RESOURCE,
    EXPORTER,
    /** Another pipeline was already registered process-wide. */
    REGISTRATION
  }

  final Stage stage;

  TracingInitializationException(Stage stage, String message, Throwable cause) {
    super(message, cause);
    this.stage = stage;
  }

  public Stage stage() {
    return stage;
  }
}
