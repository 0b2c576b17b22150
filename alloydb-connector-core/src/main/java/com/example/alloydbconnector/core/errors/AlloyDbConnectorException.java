package com.example.alloydbconnector.core.errors;

/**
 * Base type for failures raised while refreshing or dialing an AlloyDB instance.
 *
 * <p>Every failure names the instance it concerns, so a dialer serving many instances can
 * attribute it without extra bookkeeping.
 */
public abstract class AlloyDbConnectorException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final String instanceUri;

  protected AlloyDbConnectorException(
      final String kind, final String message, final String instanceUri, final Throwable cause) {
    super(format(kind, message, instanceUri, cause), cause);
    this.instanceUri = instanceUri;
  }

  /** Returns the canonical URI of the instance the failure belongs to. */
  public String getInstanceUri() {
    return instanceUri;
  }

  private static String format(
      final String kind, final String message, final String instanceUri, final Throwable cause) {
    final var sb = new StringBuilder(kind).append(": ").append(message);
    sb.append(" (instance URI = \"").append(instanceUri).append("\")");
    if (cause != null) sb.append(": ").append(cause.getMessage());
    return sb.toString();
  }
}
