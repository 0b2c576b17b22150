package com.example.alloydbconnector.core;

import com.example.alloydbconnector.core.api.AdminApiClient;
import com.example.alloydbconnector.core.api.ClientCertificateResponse;
import com.example.alloydbconnector.core.errors.RefreshException;
import com.example.alloydbconnector.core.tls.CsrGenerator;
import com.example.alloydbconnector.core.tls.PemCertificates;
import com.example.alloydbconnector.core.trace.Tracer;
import java.security.KeyPair;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.Map;

/**
 * Obtains a short-lived client certificate for a caller-supplied key pair.
 *
 * <p>The service answers with the signed client certificate and a two element chain,
 * intermediate first and root last. Anything else breaks the API contract and fails the fetch.
 */
final class EphemeralCertificateFetcher {

  static final String SPAN_NAME = "alloydb.connector.FetchEphemeralCert";

  private final AdminApiClient client;
  private final Tracer tracer;

  EphemeralCertificateFetcher(final AdminApiClient client, final Tracer tracer) {
    this.client = client;
    this.tracer = tracer;
  }

  CertChain fetch(final RefreshContext ctx, final InstanceUri instance, final KeyPair keyPair) {
    final var end =
        tracer.startSpan(SPAN_NAME, Map.of(Tracer.INSTANCE_ATTRIBUTE, instance.toString()));
    RuntimeException failure = null;
    try {
      return doFetch(ctx, instance, keyPair);
    } catch (final RuntimeException e) {
      failure = e;
      throw e;
    } finally {
      end.end(failure);
    }
  }

  private CertChain doFetch(
      final RefreshContext ctx, final InstanceUri instance, final KeyPair keyPair) {
    final var uri = instance.toString();

    final String csr;
    try {
      csr = CsrGenerator.createPem(keyPair);
    } catch (final RuntimeException e) {
      throw new RefreshException("failed to create certificate signing request", uri, e);
    }

    final var response = generate(ctx, instance, csr);
    final var chain = response.pemCertificateChain();
    if (chain.size() != 2)
      throw new RefreshException(
          "missing instance and root certificates",
          uri,
          new IllegalStateException("expected 2 chain certificates, got " + chain.size()));

    final var root = parse(chain.get(1), "failed to parse root cert", uri);
    final var intermediate = parse(chain.get(0), "failed to parse intermediate cert", uri);
    final var client = parse(response.pemCertificate(), "failed to parse client cert", uri);
    return new CertChain(root, intermediate, client);
  }

  private ClientCertificateResponse generate(
      final RefreshContext ctx, final InstanceUri instance, final String csr) {
    try {
      return client.generateClientCertificate(
          ctx, instance.project(), instance.region(), instance.cluster(), instance.name(), csr);
    } catch (final RuntimeException e) {
      throw new RefreshException("create ephemeral cert failed", instance.toString(), e);
    }
  }

  private static X509Certificate parse(final String pem, final String message, final String uri) {
    try {
      return PemCertificates.parse(pem);
    } catch (final CertificateException e) {
      throw new RefreshException(message, uri, e);
    }
  }
}
