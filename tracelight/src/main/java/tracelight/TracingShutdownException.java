/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelight;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raised when one or more {@linkplain ShutdownCallback shutdown callbacks} failed. All callbacks
 * ran regardless: {@link #failures()} holds every failure in registration order, and each is also
 * {@linkplain #getSuppressed() suppressed} by this exception.
 */
public final class TracingShutdownException extends Exception {
  static final long serialVersionUID = 0L;

  final List<Throwable> failures;

  TracingShutdownException(List<Throwable> failures) {
    super(message(failures));
    this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
    for (Throwable failure : failures) addSuppressed(failure);
  }

  /** Never empty. */
  public List<Throwable> failures() {
    return failures;
  }

  static String message(List<Throwable> failures) {
    if (failures.isEmpty()) throw new IllegalArgumentException("failures are empty");
    StringBuilder result = new StringBuilder();
    result.append(failures.size()).append(failures.size() == 1 ? " failure" : " failures")
      .append(" shutting down tracing: ");
    for (int i = 0; i < failures.size(); i++) {
      if (i > 0) result.append("; ");
      result.append(failures.get(i).getMessage());
    }
    return result.toString();
  }
}
