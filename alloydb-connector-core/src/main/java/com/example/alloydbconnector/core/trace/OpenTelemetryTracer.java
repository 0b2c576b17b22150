package com.example.alloydbconnector.core.trace;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.trace.StatusCode;
import java.util.Map;

/**
 * {@link Tracer} reporting spans and refresh counts through OpenTelemetry.
 *
 * <p>Each refresh increments {@value #REFRESH_COUNT} with the instance, the dialer id and {@code
 * success} or {@code failure}.
 */
public final class OpenTelemetryTracer implements Tracer {

  static final String INSTRUMENTATION_SCOPE = "com.example.alloydbconnector";
  static final String REFRESH_COUNT = "alloydbconn/refresh_count";

  static final AttributeKey<String> INSTANCE_KEY = AttributeKey.stringKey("alloydb_instance");
  static final AttributeKey<String> DIALER_ID_KEY = AttributeKey.stringKey("alloydb_dialer_id");
  static final AttributeKey<String> STATUS_KEY = AttributeKey.stringKey("alloydb_refresh_status");

  private final io.opentelemetry.api.trace.Tracer tracer;
  private final LongCounter refreshCount;

  public OpenTelemetryTracer(final OpenTelemetry openTelemetry) {
    this.tracer = openTelemetry.getTracer(INSTRUMENTATION_SCOPE);
    this.refreshCount =
        openTelemetry
            .getMeter(INSTRUMENTATION_SCOPE)
            .counterBuilder(REFRESH_COUNT)
            .setDescription("Number of refresh operations, by outcome")
            .build();
  }

  /** Uses the globally registered {@link OpenTelemetry} instance. */
  public OpenTelemetryTracer() {
    this(GlobalOpenTelemetry.get());
  }

  @Override
  public EndSpan startSpan(final String name, final Map<String, String> attributes) {
    final var builder = tracer.spanBuilder(name);
    attributes.forEach(builder::setAttribute);
    final var span = builder.startSpan();
    return error -> {
      if (error != null) {
        span.recordException(error);
        span.setStatus(StatusCode.ERROR, String.valueOf(error.getMessage()));
      }
      span.end();
    };
  }

  @Override
  public void recordRefreshResult(
      final String instance, final String dialerId, final Throwable error) {
    refreshCount.add(
        1,
        Attributes.of(
            INSTANCE_KEY,
            instance,
            DIALER_ID_KEY,
            dialerId,
            STATUS_KEY,
            error == null ? "success" : "failure"));
  }
}
