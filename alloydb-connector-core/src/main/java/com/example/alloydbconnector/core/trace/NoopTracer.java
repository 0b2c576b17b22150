package com.example.alloydbconnector.core.trace;

import java.util.Map;

enum NoopTracer implements Tracer {
  INSTANCE;

  private static final EndSpan NOOP_END = error -> {};

  @Override
  public EndSpan startSpan(final String name, final Map<String, String> attributes) {
    return NOOP_END;
  }

  @Override
  public void recordRefreshResult(
      final String instance, final String dialerId, final Throwable error) {}
}
