package com.example.alloydbconnector.core.tls;

import com.example.alloydbconnector.core.InstanceUri;
import com.example.alloydbconnector.core.errors.DialException;
import java.security.GeneralSecurityException;
import java.security.cert.CertPathBuilder;
import java.security.cert.CertStore;
import java.security.cert.CertificateException;
import java.security.cert.CertificateParsingException;
import java.security.cert.CollectionCertStoreParameters;
import java.security.cert.PKIXBuilderParameters;
import java.security.cert.TrustAnchor;
import java.security.cert.X509CertSelector;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x500.style.IETFUtils;

/**
 * Decides whether the certificate chain presented by an instance's server-side proxy belongs to
 * that instance.
 *
 * <p>The proxy is reached by IP address and its certificate carries no usable DNS name, so
 * hostname verification cannot apply. Instead the leaf must chain to the root issued with the
 * client certificate, and its common name must be {@code <instance UID>.server.alloydb}.
 */
public final class PeerVerifier {

  static final String SERVER_NAME_SUFFIX = ".server.alloydb";

  private static final String SERVER_AUTH = "1.3.6.1.5.5.7.3.1";
  private static final String ANY_EXTENDED_KEY_USAGE = "2.5.29.37.0";

  private final String instanceUri;
  private final X509Certificate root;
  private final String expectedCommonName;

  /**
   * @param instance the instance being dialed
   * @param root trust anchor returned by the last certificate fetch
   * @param instanceUid UID returned by the last metadata fetch
   */
  public PeerVerifier(
      final InstanceUri instance, final X509Certificate root, final String instanceUid) {
    this.instanceUri = instance.toString();
    this.root = root;
    this.expectedCommonName = instanceUid + SERVER_NAME_SUFFIX;
  }

  /**
   * Verifies a handshake chain, leaf first.
   *
   * @param rawCertificates DER encoded certificates as presented by the peer
   * @throws DialException if a certificate does not parse, the chain does not verify to the root,
   *     or the leaf names another instance
   */
  public void verify(final List<byte[]> rawCertificates) {
    final var parsed = new ArrayList<X509Certificate>(rawCertificates.size());
    for (final var raw : rawCertificates) {
      try {
        parsed.add(PemCertificates.parseDer(raw));
      } catch (final CertificateException e) {
        throw new DialException("failed to parse X.509 certificate", instanceUri, e);
      }
    }
    if (parsed.isEmpty())
      throw new DialException(
          "failed to verify certificate",
          instanceUri,
          new CertificateException("peer presented no certificates"));

    final var server = parsed.get(0);
    try {
      verifyChain(server, parsed.subList(1, parsed.size()));
    } catch (final GeneralSecurityException e) {
      throw new DialException("failed to verify certificate", instanceUri, e);
    }

    final var commonName = commonName(server).orElse("");
    if (!expectedCommonName.equals(commonName))
      throw new DialException(
          String.format(
              "certificate had CN \"%s\", expected \"%s\"", commonName, expectedCommonName),
          instanceUri,
          null);
  }

  /** Returns the CN the server certificate must carry. */
  public String expectedCommonName() {
    return expectedCommonName;
  }

  X509Certificate root() {
    return root;
  }

  private void verifyChain(final X509Certificate server, final List<X509Certificate> intermediates)
      throws GeneralSecurityException {
    final var target = new X509CertSelector();
    target.setCertificate(server);

    final var params = new PKIXBuilderParameters(Set.of(new TrustAnchor(root, null)), target);
    params.setRevocationEnabled(false);

    final var pool = new ArrayList<X509Certificate>(intermediates);
    pool.add(server);
    params.addCertStore(
        CertStore.getInstance("Collection", new CollectionCertStoreParameters(pool)));

    CertPathBuilder.getInstance("PKIX").build(params);
    checkServerAuthUsage(server);
  }

  // A leaf without the extension may be used for anything.
  private static void checkServerAuthUsage(final X509Certificate server)
      throws CertificateParsingException {
    final var usages = server.getExtendedKeyUsage();
    if (usages == null || usages.contains(SERVER_AUTH) || usages.contains(ANY_EXTENDED_KEY_USAGE))
      return;
    throw new CertificateParsingException(
        "certificate is not valid for server authentication: " + usages);
  }

  static Optional<String> commonName(final X509Certificate certificate) {
    final var rdns =
        X500Name.getInstance(certificate.getSubjectX500Principal().getEncoded())
            .getRDNs(BCStyle.CN);
    if (rdns.length == 0) return Optional.empty();
    return Optional.of(IETFUtils.valueToString(rdns[rdns.length - 1].getFirst().getValue()));
  }
}
