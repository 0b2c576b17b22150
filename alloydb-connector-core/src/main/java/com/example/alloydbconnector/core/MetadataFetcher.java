package com.example.alloydbconnector.core;

import com.example.alloydbconnector.core.api.AdminApiClient;
import com.example.alloydbconnector.core.errors.RefreshException;
import com.example.alloydbconnector.core.trace.Tracer;
import java.util.Map;

/** Resolves an instance to its current address and UID through the admin API. */
final class MetadataFetcher {

  static final String SPAN_NAME = "alloydb.connector.FetchMetadata";

  private final AdminApiClient client;
  private final Tracer tracer;

  MetadataFetcher(final AdminApiClient client, final Tracer tracer) {
    this.client = client;
    this.tracer = tracer;
  }

  /**
   * Fetches connection metadata once. Never retries.
   *
   * @throws RefreshException wrapping whatever the client raised
   */
  ConnectInfo fetch(final RefreshContext ctx, final InstanceUri instance) {
    final var end =
        tracer.startSpan(SPAN_NAME, Map.of(Tracer.INSTANCE_ATTRIBUTE, instance.toString()));
    RuntimeException failure = null;
    try {
      final var response =
          client.connectionInfo(
              ctx, instance.project(), instance.region(), instance.cluster(), instance.name());
      return new ConnectInfo(response.ipAddress(), response.instanceUid());
    } catch (final RuntimeException e) {
      failure = new RefreshException("failed to get instance metadata", instance.toString(), e);
      throw failure;
    } finally {
      end.end(failure);
    }
  }
}
