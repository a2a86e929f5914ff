/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelight.context.log4j2;

import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Locale;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.Appender;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.StringLayout;
import org.apache.logging.log4j.core.appender.ConsoleAppender;
import org.apache.logging.log4j.core.appender.OutputStreamAppender;
import org.apache.logging.log4j.core.appender.rewrite.RewriteAppender;
import org.apache.logging.log4j.core.config.AbstractConfiguration;
import org.apache.logging.log4j.core.config.AppenderRef;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.layout.PatternLayout;
import org.apache.logging.log4j.layout.template.json.JsonTemplateLayout;

/**
 * Points the root logger of the current {@link LoggerContext} at standard out, through {@link
 * TraceContextRewritePolicy}, replacing any appenders it had.
 *
 * <p>Call this once at process start, typically alongside {@code Tracing.initialize}. Calling it
 * again replaces the previous setup.
 */
public final class LoggingSetup {
  /** Selects {@value #EVENT_TEMPLATE_URI}. Any other format selects plain text. */
  public static final String FORMAT_JSON = "json";

  static final String EVENT_TEMPLATE_URI = "classpath:CloudLoggingLayout.json";
  static final String TEXT_PATTERN = "%d{ISO8601} %-5level [%t] %logger{36} (%F:%L %M) - %msg"
    + "%notEmpty{ trace=%X{" + CloudLoggingFields.TRACE + "}}"
    + "%notEmpty{ span=%X{" + CloudLoggingFields.SPAN_ID + "}}%n%throwable";
  static final String SINK_NAME = "tracelight.sink";
  static final String REWRITE_NAME = "tracelight.rewrite";

  /** Logs to {@link System#out}. */
  public static void configure(String level, String format) {
    configure(level, format, null);
  }

  /**
   * @param level minimum level, such as "debug" or "warning", ignoring case. Unrecognized values
   * log a warning and use {@code info}.
   * @param format {@value #FORMAT_JSON} for one Cloud Logging JSON object per line, otherwise text
   * @param out destination, or null for {@link System#out}
   */
  public static void configure(String level, String format, OutputStream out) {
    LoggerContext context = LoggerContext.getContext(false);
    Configuration config = context.getConfiguration();
    Level minimumLevel = parseLevel(level);

    removeAppender(config, REWRITE_NAME);
    removeAppender(config, SINK_NAME);

    Appender sink = newSink(config, newLayout(config, format), out);
    sink.start();
    config.addAppender(sink);

    // Resolves its AppenderRef on start, so the sink has to be added first.
    Appender rewrite = RewriteAppender.createAppender(REWRITE_NAME, "true",
      new AppenderRef[] {AppenderRef.createAppenderRef(SINK_NAME, null, null)}, config,
      TraceContextRewritePolicy.get(), null);
    rewrite.start();
    config.addAppender(rewrite);

    LoggerConfig root = config.getRootLogger();
    for (String name : new ArrayList<>(root.getAppenders().keySet())) root.removeAppender(name);
    root.addAppender(rewrite, null, null);
    root.setLevel(minimumLevel != null ? minimumLevel : Level.INFO);
    context.updateLoggers();

    if (minimumLevel == null) {
      LogManager.getLogger(LoggingSetup.class)
        .warn("invalid log level \"{}\", defaulting to info", level);
    }
  }

  /**
   * Accepts Log4j level names, plus {@code warning}. Null or blank is {@code INFO}. Returns null
   * if unrecognized.
   */
  static Level parseLevel(String level) {
    if (level == null || level.trim().isEmpty()) return Level.INFO;
    String normalized = level.trim().toUpperCase(Locale.ROOT);
    if (normalized.equals("WARNING")) return Level.WARN;
    return Level.toLevel(normalized, null);
  }

  static StringLayout newLayout(Configuration config, String format) {
    if (isJson(format)) {
      return JsonTemplateLayout.newBuilder()
        .setConfiguration(config)
        .setEventTemplateUri(EVENT_TEMPLATE_URI)
        .setLocationInfoEnabled(true)
        .build();
    }
    return PatternLayout.newBuilder().withConfiguration(config).withPattern(TEXT_PATTERN).build();
  }

  static Appender newSink(Configuration config, StringLayout layout, OutputStream out) {
    if (out == null) {
      return ConsoleAppender.newBuilder()
        .setName(SINK_NAME)
        .setLayout(layout)
        .setTarget(ConsoleAppender.Target.SYSTEM_OUT)
        .setConfiguration(config)
        .build();
    }
    return OutputStreamAppender.newBuilder()
      .setName(SINK_NAME)
      .setLayout(layout)
      .setTarget(out)
      .setConfiguration(config)
      .build();
  }

  static boolean isJson(String format) {
    return format != null && format.trim().equalsIgnoreCase(FORMAT_JSON);
  }

  static void removeAppender(Configuration config, String name) {
    if (config instanceof AbstractConfiguration) {
      ((AbstractConfiguration) config).removeAppender(name); // also stops it
    }
  }

  LoggingSetup() {
  }
}
