package com.example.alloydbconnector.core.trace;

import java.util.Map;

/**
 * Observability hook for refreshes. Implementations must not throw and must be safe for
 * concurrent use.
 */
public interface Tracer {

  /** Span attribute naming the instance URI. */
  String INSTANCE_ATTRIBUTE = "/alloydb/instance";

  /** Span attribute naming the dialer that owns a refresher. */
  String DIALER_ID_ATTRIBUTE = "/alloydb/dialer_id";

  /**
   * Opens a span.
   *
   * @param name span name
   * @param attributes attributes attached at start
   * @return callback ending the span
   */
  EndSpan startSpan(String name, Map<String, String> attributes);

  /**
   * Records the outcome of one refresh. Called off the caller's thread.
   *
   * @param instance instance URI
   * @param dialerId id of the owning dialer
   * @param error failure, or null for a successful refresh
   */
  void recordRefreshResult(String instance, String dialerId, Throwable error);

  /** Returns a tracer that records nothing. */
  static Tracer noop() {
    return NoopTracer.INSTANCE;
  }
}
