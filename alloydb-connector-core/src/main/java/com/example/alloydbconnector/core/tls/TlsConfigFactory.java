package com.example.alloydbconnector.core.tls;

import com.example.alloydbconnector.core.CertChain;
import com.example.alloydbconnector.core.ConnectInfo;
import com.example.alloydbconnector.core.InstanceUri;
import com.example.alloydbconnector.core.errors.DialException;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.UUID;
import javax.net.ssl.KeyManager;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;

/** Assembles the {@link TlsConfig} used to dial an instance's server-side proxy. */
public final class TlsConfigFactory {

  private static final String KEY_ALIAS = "alloydb-client";

  private TlsConfigFactory() {}

  /**
   * Builds a TLS 1.3 client configuration that presents {@code chain.client} and {@code
   * chain.intermediate}, and accepts only a server chain verifying to {@code chain.root} whose leaf
   * is named after {@code info.instanceUid()}. Performs no I/O.
   *
   * @param instance instance being dialed, for error reporting
   * @param chain freshly issued client identity
   * @param info freshly fetched connection metadata
   * @param keyPair key pair the client certificate was issued for
   * @return the configuration
   * @throws DialException if the JSSE objects cannot be created
   */
  public static TlsConfig create(
      final InstanceUri instance,
      final CertChain chain,
      final ConnectInfo info,
      final KeyPair keyPair) {
    final var presented = List.of(chain.client(), chain.intermediate());
    final var verifier = new PeerVerifier(instance, chain.root(), info.instanceUid());
    try {
      final var context = SSLContext.getInstance(TlsConfig.PROTOCOL);
      context.init(
          keyManagers(keyPair.getPrivate(), presented),
          new TrustManager[] {new InstanceTrustManager(verifier)},
          null);
      return new TlsConfig(context, presented, chain.root());
    } catch (final GeneralSecurityException | IOException e) {
      throw new DialException("failed to create TLS configuration", instance.toString(), e);
    }
  }

  private static KeyManager[] keyManagers(
      final PrivateKey key, final List<X509Certificate> certificates)
      throws GeneralSecurityException, IOException {
    // Never written out; the password only satisfies the PKCS#12 API.
    final var password = UUID.randomUUID().toString().toCharArray();
    final var keyStore = KeyStore.getInstance("PKCS12");
    keyStore.load(null, null);
    keyStore.setKeyEntry(KEY_ALIAS, key, password, certificates.toArray(new Certificate[0]));

    final var factory = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
    factory.init(keyStore, password);
    return factory.getKeyManagers();
  }
}
