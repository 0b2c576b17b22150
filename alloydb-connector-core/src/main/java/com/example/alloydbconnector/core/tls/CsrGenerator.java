package com.example.alloydbconnector.core.tls;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.security.KeyPair;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.bouncycastle.pkcs.jcajce.JcaPKCS10CertificationRequestBuilder;
import org.bouncycastle.util.io.pem.PemObject;

/**
 * Builds the certificate signing request submitted for an ephemeral client certificate.
 *
 * <p>Subject and signature algorithm are fixed; only the key pair varies.
 */
public final class CsrGenerator {

  static final String SIGNATURE_ALGORITHM = "SHA256withRSA";

  static final X500Name SUBJECT =
      new X500NameBuilder(BCStyle.INSTANCE)
          .addRDN(BCStyle.C, "US")
          .addRDN(BCStyle.ST, "CA")
          .addRDN(BCStyle.L, "Sunnyvale")
          .addRDN(BCStyle.O, "Google LLC")
          .addRDN(BCStyle.OU, "Cloud")
          .addRDN(BCStyle.CN, "alloydb-proxy")
          .build();

  private CsrGenerator() {}

  /**
   * Creates a PEM-encoded PKCS#10 request for the public key of {@code keyPair}, signed with its
   * private key.
   *
   * @param keyPair an RSA key pair
   * @return {@code CERTIFICATE REQUEST} PEM block
   * @throws IllegalArgumentException if the key pair is not RSA or cannot sign
   */
  public static String createPem(final KeyPair keyPair) {
    if (!"RSA".equals(keyPair.getPrivate().getAlgorithm()))
      throw new IllegalArgumentException(
          "expected an RSA key pair, got " + keyPair.getPrivate().getAlgorithm());
    try {
      final var signer =
          new JcaContentSignerBuilder(SIGNATURE_ALGORITHM)
              .setProvider(BouncyCastleProviderHolder.getInstance())
              .build(keyPair.getPrivate());
      final var csr =
          new JcaPKCS10CertificationRequestBuilder(SUBJECT, keyPair.getPublic()).build(signer);
      return PemCertificates.toPem(new PemObject("CERTIFICATE REQUEST", csr.getEncoded()));
    } catch (final OperatorCreationException e) {
      throw new IllegalArgumentException("key pair cannot sign a CSR", e);
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
