/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracelight;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.sdk.resources.Resource;
import java.util.Locale;

/** Builds the immutable {@link Resource} attached to every span this process exports. */
public final class TracingResources {
  public static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  static final AttributeKey<Long> PROCESS_PID = AttributeKey.longKey("process.pid");
  static final AttributeKey<String> PROCESS_RUNTIME_NAME =
    AttributeKey.stringKey("process.runtime.name");
  static final AttributeKey<String> PROCESS_RUNTIME_VERSION =
    AttributeKey.stringKey("process.runtime.version");
  static final AttributeKey<String> OS_TYPE = AttributeKey.stringKey("os.type");

  /**
   * Returns the SDK defaults, then detected process metadata, then {@code configured} attributes,
   * then the service name. Later sources win when keys collide.
   *
   * @param configured typically {@link TracingConfig#resourceAttributes()}
   */
  public static Resource create(String serviceName, Attributes configured) {
    if (serviceName == null) throw new NullPointerException("serviceName == null");
    if (serviceName.trim().isEmpty()) {
      throw new IllegalArgumentException("serviceName is empty");
    }
    if (configured == null) throw new NullPointerException("configured == null");
    return Resource.getDefault()
      .merge(Resource.create(detect()))
      .merge(Resource.create(configured))
      .merge(Resource.create(Attributes.of(SERVICE_NAME, serviceName)));
  }

  static Attributes detect() {
    AttributesBuilder result = Attributes.builder();
    result.put(PROCESS_PID, ProcessHandle.current().pid());
    putIfPresent(result, PROCESS_RUNTIME_NAME, System.getProperty("java.runtime.name"));
    putIfPresent(result, PROCESS_RUNTIME_VERSION, System.getProperty("java.runtime.version"));
    String osName = System.getProperty("os.name");
    if (osName != null) putIfPresent(result, OS_TYPE, osType(osName));
    return result.build();
  }

  static String osType(String osName) {
    String lower = osName.toLowerCase(Locale.ROOT);
    if (lower.startsWith("windows")) return "windows";
    if (lower.startsWith("linux")) return "linux";
    if (lower.startsWith("mac")) return "darwin";
    if (lower.startsWith("freebsd")) return "freebsd";
    return lower;
  }

  static void putIfPresent(AttributesBuilder builder, AttributeKey<String> key, String value) {
    if (value != null && !value.isEmpty()) builder.put(key, value);
  }

  TracingResources() {
  }
}
