/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelight.servlet;

import io.opentelemetry.context.propagation.TextMapGetter;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Collections;
import java.util.Enumeration;

/** Reads propagation fields from request headers. */
enum HttpServletRequestGetter implements TextMapGetter<HttpServletRequest> {
  INSTANCE;

  @Override public Iterable<String> keys(HttpServletRequest request) {
    Enumeration<String> names = request.getHeaderNames();
    if (names == null) return Collections.emptyList();
    return Collections.list(names);
  }

  @Override public String get(HttpServletRequest request, String key) {
    if (request == null) return null;
    return request.getHeader(key);
  }

  @Override public String toString() {
    return "HttpServletRequestGetter{}";
  }
}
