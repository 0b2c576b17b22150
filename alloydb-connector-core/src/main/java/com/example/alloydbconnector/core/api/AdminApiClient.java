package com.example.alloydbconnector.core.api;

import com.example.alloydbconnector.core.RefreshContext;

/**
 * Client for the AlloyDB Admin API methods a refresh needs.
 *
 * <p>Implementations must be safe for concurrent use: two calls for the same instance run at the
 * same time during every refresh. Failures are reported as unchecked exceptions, typically {@link
 * AdminApiException}.
 */
public interface AdminApiClient {

  /**
   * Looks up where and as whom an instance can currently be reached.
   *
   * @param ctx bounds how long the call may take
   * @param project project id
   * @param region region id
   * @param cluster cluster id
   * @param name instance id
   * @return the instance's IP address and UID
   */
  ConnectionInfo connectionInfo(
      RefreshContext ctx, String project, String region, String cluster, String name);

  /**
   * Asks the service to sign a client certificate for the given CSR.
   *
   * @param ctx bounds how long the call may take
   * @param project project id
   * @param region region id
   * @param cluster cluster id
   * @param name instance id
   * @param csrPem PEM-encoded PKCS#10 certificate signing request
   * @return the signed client certificate and its issuing chain
   */
  ClientCertificateResponse generateClientCertificate(
      RefreshContext ctx,
      String project,
      String region,
      String cluster,
      String name,
      String csrPem);
}
