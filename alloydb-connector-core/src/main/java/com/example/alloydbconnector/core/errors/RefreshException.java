package com.example.alloydbconnector.core.errors;

/**
 * Failure to obtain fresh metadata or certificates for an instance: admin API errors, malformed
 * certificates, an unexpected certificate count, or a context that finished while fetching.
 *
 * <p>Fatal to the refresh that raised it. The caller decides whether to refresh again.
 */
public final class RefreshException extends AlloyDbConnectorException {

  private static final long serialVersionUID = 1L;

  public RefreshException(final String message, final String instanceUri, final Throwable cause) {
    super("Refresh error", message, instanceUri, cause);
  }
}
