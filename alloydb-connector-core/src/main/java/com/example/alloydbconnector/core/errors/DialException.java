package com.example.alloydbconnector.core.errors;

/**
 * Failure while building or verifying the secure channel to an instance: an unparsable or
 * untrusted server certificate, a server certificate issued to another instance, or a refresh
 * throttled past its deadline.
 */
public final class DialException extends AlloyDbConnectorException {

  private static final long serialVersionUID = 1L;

  public DialException(final String message, final String instanceUri, final Throwable cause) {
    super("Dial error", message, instanceUri, cause);
  }
}
