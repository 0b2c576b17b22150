package com.example.alloydbconnector.core.tls;

import java.io.IOException;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.Optional;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;

/**
 * TLS client configuration for one instance, valid until its client certificate expires.
 *
 * <p>The context is pinned to {@value #PROTOCOL}: its default and supported parameters, and every
 * socket or engine it creates, enable no other protocol.
 *
 * @param sslContext client-only context holding the client identity and the instance trust manager
 * @param certificates chain presented to the server, client leaf first
 * @param root trust anchor the server chain must verify to
 */
public record TlsConfig(
    SSLContext sslContext, List<X509Certificate> certificates, X509Certificate root) {

  /** Only TLS 1.3 is negotiated. */
  public static final String PROTOCOL = "TLSv1.3";

  public TlsConfig {
    sslContext = Tls13OnlyContext.pin(sslContext);
    certificates = List.copyOf(certificates);
  }

  /** Returns the client leaf certificate, if one is embedded. */
  public Optional<X509Certificate> leaf() {
    return certificates.isEmpty() ? Optional.empty() : Optional.of(certificates.get(0));
  }

  /**
   * Returns fresh parameters pinning the protocol and leaving endpoint identification off, since
   * {@link PeerVerifier} replaces it.
   */
  public SSLParameters sslParameters() {
    return sslContext.getDefaultSSLParameters();
  }

  /**
   * Opens a TLS socket to {@code host:port}. The handshake runs on first I/O or {@link
   * SSLSocket#startHandshake()}.
   *
   * @param host address of the instance
   * @param port server-side proxy port
   * @return connected, configured socket
   * @throws IOException if the connection cannot be opened
   */
  public SSLSocket createSocket(final String host, final int port) throws IOException {
    return (SSLSocket) sslContext.getSocketFactory().createSocket(host, port);
  }

  public SSLEngine createEngine(final String host, final int port) {
    return sslContext.createSSLEngine(host, port);
  }
}
