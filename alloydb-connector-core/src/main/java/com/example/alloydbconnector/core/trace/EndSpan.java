package com.example.alloydbconnector.core.trace;

/** Closes a span opened by {@link Tracer#startSpan}. */
@FunctionalInterface
public interface EndSpan {

  /**
   * Ends the span.
   *
   * @param error the failure the traced operation ended with, or null on success
   */
  void end(Throwable error);
}
