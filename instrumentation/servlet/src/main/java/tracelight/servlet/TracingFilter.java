/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelight.servlet;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapPropagator;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.FilterConfig;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Traces each HTTP request as a {@link SpanKind#SERVER server} span, continuing any trace
 * propagated in its headers.
 *
 * <p>The span is named after the {@code method} field of a JSON object body, as sent by JSON-RPC
 * style clients, or otherwise "METHOD path", such as "GET /users". To read that field, JSON bodies
 * ({@code application/json} or {@code *+json}) are buffered in memory, and the servlet still reads
 * the whole body. Other requests are passed on unwrapped, so form parameters remain readable.
 *
 * <p>Requests to the health-check path are not traced.
 */
public final class TracingFilter implements Filter {
  public static final String DEFAULT_HEALTH_CHECK_PATH = "/health";
  public static final String INSTRUMENTATION_NAME = "tracelight.servlet";

  static final AttributeKey<String> SERVER_TYPE = AttributeKey.stringKey("server.type");
  static final AttributeKey<String> HTTP_REQUEST_METHOD =
    AttributeKey.stringKey("http.request.method");
  static final AttributeKey<String> URL_PATH = AttributeKey.stringKey("url.path");
  static final AttributeKey<Long> HTTP_RESPONSE_STATUS_CODE =
    AttributeKey.longKey("http.response.status_code");

  static final Logger LOG = Logger.getLogger(TracingFilter.class.getName());
  static final ObjectMapper MAPPER = new ObjectMapper();
  static final byte[] NO_BODY = new byte[0];

  public static Filter create(OpenTelemetry openTelemetry) {
    return newBuilder(openTelemetry).build();
  }

  public static Builder newBuilder(OpenTelemetry openTelemetry) {
    return new Builder(openTelemetry);
  }

  public static final class Builder {
    final OpenTelemetry openTelemetry;
    String healthCheckPath = DEFAULT_HEALTH_CHECK_PATH;

    Builder(OpenTelemetry openTelemetry) {
      if (openTelemetry == null) throw new NullPointerException("openTelemetry == null");
      this.openTelemetry = openTelemetry;
    }

    /**
     * Requests whose URI equals this are not traced. Defaults to {@value
     * TracingFilter#DEFAULT_HEALTH_CHECK_PATH}.
     */
    public Builder healthCheckPath(String healthCheckPath) {
      if (healthCheckPath == null) throw new NullPointerException("healthCheckPath == null");
      this.healthCheckPath = healthCheckPath;
      return this;
    }

    public TracingFilter build() {
      return new TracingFilter(this);
    }
  }

  final Tracer tracer;
  final TextMapPropagator propagator;
  final String healthCheckPath;

  TracingFilter(Builder builder) {
    tracer = builder.openTelemetry.getTracer(INSTRUMENTATION_NAME);
    propagator = builder.openTelemetry.getPropagators().getTextMapPropagator();
    healthCheckPath = builder.healthCheckPath;
  }

  @Override
  public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
    throws IOException, ServletException {
    if (!(request instanceof HttpServletRequest) || !(response instanceof HttpServletResponse)) {
      chain.doFilter(request, response);
      return;
    }
    HttpServletRequest req = (HttpServletRequest) request;
    HttpServletResponse res = (HttpServletResponse) response;

    // Prevent duplicate spans for the same request, such as on forward
    Object existing = request.getAttribute(SpanContext.class.getName());
    if (existing instanceof SpanContext) {
      try (Scope scope = Context.current().with(Span.wrap((SpanContext) existing)).makeCurrent()) {
        chain.doFilter(request, response);
      }
      return;
    }

    String path = req.getRequestURI();
    if (healthCheckPath.equals(path)) {
      chain.doFilter(request, response);
      return;
    }

    HttpServletRequest downstream = req;
    byte[] body = NO_BODY;
    if (isJson(req.getContentType())) {
      BufferedBodyRequest buffered = BufferedBodyRequest.create(req);
      downstream = buffered;
      body = buffered.body();
    }
    String method = req.getMethod();
    Context parent = propagator.extract(Context.current(), req, HttpServletRequestGetter.INSTANCE);
    Span span = tracer.spanBuilder(spanName(method, path, body))
      .setParent(parent)
      .setSpanKind(SpanKind.SERVER)
      .setAttribute(SERVER_TYPE, "http")
      .setAttribute(HTTP_REQUEST_METHOD, method)
      .setAttribute(URL_PATH, path)
      .startSpan();
    request.setAttribute(SpanContext.class.getName(), span.getSpanContext());

    Throwable error = null;
    try (Scope scope = span.makeCurrent()) {
      // downstream code sees this span as Span.current()
      chain.doFilter(downstream, res);
    } catch (Throwable e) {
      error = e;
      throw e;
    } finally {
      if (error != null) {
        // the container hasn't picked the error status yet
        span.recordException(error);
        span.setStatus(StatusCode.ERROR, error.getClass().getSimpleName());
      } else {
        int status = res.getStatus();
        span.setAttribute(HTTP_RESPONSE_STATUS_CODE, (long) status);
        if (status >= 500) span.setStatus(StatusCode.ERROR);
      }
      span.end();
    }
  }

  /**
   * Returns the JSON body's top-level {@code method} field when it is a non-blank string,
   * otherwise "METHOD path".
   */
  static String spanName(String method, String path, byte[] body) {
    String fromBody = jsonMethod(body);
    if (fromBody != null) return fromBody;
    return method + " " + path;
  }

  static String jsonMethod(byte[] body) {
    if (!startsWithObject(body)) return null;
    JsonNode node;
    try {
      node = MAPPER.readTree(body);
    } catch (JsonProcessingException e) {
      LOG.log(Level.FINE, "request body isn't JSON; naming span after the request line", e);
      return null;
    } catch (IOException e) {
      LOG.log(Level.FINE, "couldn't read request body; naming span after the request line", e);
      return null;
    }
    JsonNode method = node != null ? node.get("method") : null;
    if (method == null || !method.isTextual()) return null;
    String result = method.asText().trim();
    return result.isEmpty() ? null : result;
  }

  /** True for {@code application/json} and structured suffixes like {@code application/ld+json}. */
  static boolean isJson(String contentType) {
    if (contentType == null) return false;
    int semicolon = contentType.indexOf(';');
    String mediaType = (semicolon == -1 ? contentType : contentType.substring(0, semicolon))
      .trim().toLowerCase(Locale.ROOT);
    return mediaType.equals("application/json") || mediaType.endsWith("+json");
  }

  /** Avoids parsing bodies that can't be a JSON object, such as form posts. */
  static boolean startsWithObject(byte[] body) {
    for (byte b : body) {
      if (b == ' ' || b == '\t' || b == '\r' || b == '\n') continue;
      return b == '{';
    }
    return false;
  }

  @Override public void destroy() {
  }

  @Override public void init(FilterConfig filterConfig) {
  }

  @Override public String toString() {
    return "TracingFilter{healthCheckPath=" + healthCheckPath + "}";
  }
}
