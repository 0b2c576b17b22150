package com.example.alloydbconnector.core.tls;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.security.cert.CertificateEncodingException;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;

/** Conversions between PEM text and {@link X509Certificate}. */
public final class PemCertificates {

  private PemCertificates() {}

  /**
   * Decodes the first PEM block of {@code pem} as an X.509 certificate. Text before the block is
   * ignored.
   *
   * @param pem text expected to hold one PEM block
   * @return the parsed certificate
   * @throws InvalidPemException if no complete, base64-decodable PEM block is found
   * @throws CertificateException if the block's content is not a DER encoded certificate
   */
  public static X509Certificate parse(final String pem) throws CertificateException {
    if (pem == null) throw new InvalidPemException();

    final PemObject block;
    try (var reader = new PemReader(new StringReader(pem))) {
      block = reader.readPemObject();
    } catch (final IOException | DecoderException e) {
      throw new InvalidPemException(e);
    }
    if (block == null) throw new InvalidPemException();

    return parseDer(block.getContent());
  }

  /**
   * Decodes a DER encoded X.509 certificate.
   *
   * @param der certificate bytes
   * @return the parsed certificate
   * @throws CertificateException if the bytes are not a certificate
   */
  public static X509Certificate parseDer(final byte[] der) throws CertificateException {
    return (X509Certificate)
        CertificateFactory.getInstance("X.509").generateCertificate(new ByteArrayInputStream(der));
  }

  /**
   * Encodes a certificate as a single {@code CERTIFICATE} PEM block.
   *
   * @param certificate the certificate to encode
   * @return PEM text
   */
  public static String toPem(final X509Certificate certificate) {
    try {
      return toPem(new PemObject("CERTIFICATE", certificate.getEncoded()));
    } catch (final CertificateEncodingException e) {
      throw new IllegalArgumentException("certificate cannot be encoded", e);
    }
  }

  static String toPem(final PemObject pemObject) {
    try (var stringWriter = new StringWriter();
        var pemWriter = new JcaPEMWriter(stringWriter)) {
      pemWriter.writeObject(pemObject);
      pemWriter.flush();
      return stringWriter.toString();
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
