package com.example.alloydbconnector.core.api;

import java.util.OptionalInt;

/** Failed admin API call: transport error, non-success status or unreadable payload. */
public class AdminApiException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final Integer statusCode;

  public AdminApiException(final String message, final Throwable cause) {
    super(message, cause);
    this.statusCode = null;
  }

  public AdminApiException(final int statusCode, final String body) {
    super("admin API returned HTTP " + statusCode + ": " + body);
    this.statusCode = statusCode;
  }

  /** Returns the HTTP status when the service answered, empty for transport failures. */
  public OptionalInt statusCode() {
    return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
  }
}
