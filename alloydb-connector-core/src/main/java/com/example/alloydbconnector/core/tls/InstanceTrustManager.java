package com.example.alloydbconnector.core.tls;

import com.example.alloydbconnector.core.errors.DialException;
import java.net.Socket;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.X509ExtendedTrustManager;

/**
 * Client-side trust manager that hands every server chain to a {@link PeerVerifier}.
 *
 * <p>JSSE only accepts {@link CertificateException} from a trust manager, so the verifier's
 * {@link DialException} travels as its cause.
 */
final class InstanceTrustManager extends X509ExtendedTrustManager {

  private final PeerVerifier verifier;

  InstanceTrustManager(final PeerVerifier verifier) {
    this.verifier = verifier;
  }

  @Override
  public void checkServerTrusted(final X509Certificate[] chain, final String authType)
      throws CertificateException {
    final var raw = new ArrayList<byte[]>(chain == null ? 0 : chain.length);
    if (chain != null) for (final var certificate : chain) raw.add(certificate.getEncoded());
    verify(raw);
  }

  @Override
  public void checkServerTrusted(
      final X509Certificate[] chain, final String authType, final Socket socket)
      throws CertificateException {
    checkServerTrusted(chain, authType);
  }

  @Override
  public void checkServerTrusted(
      final X509Certificate[] chain, final String authType, final SSLEngine engine)
      throws CertificateException {
    checkServerTrusted(chain, authType);
  }

  @Override
  public void checkClientTrusted(final X509Certificate[] chain, final String authType)
      throws CertificateException {
    throw new CertificateException("client certificates are not accepted by a dialer");
  }

  @Override
  public void checkClientTrusted(
      final X509Certificate[] chain, final String authType, final Socket socket)
      throws CertificateException {
    checkClientTrusted(chain, authType);
  }

  @Override
  public void checkClientTrusted(
      final X509Certificate[] chain, final String authType, final SSLEngine engine)
      throws CertificateException {
    checkClientTrusted(chain, authType);
  }

  @Override
  public X509Certificate[] getAcceptedIssuers() {
    return new X509Certificate[] {verifier.root()};
  }

  private void verify(final List<byte[]> raw) throws CertificateException {
    try {
      verifier.verify(raw);
    } catch (final DialException e) {
      throw new CertificateException(e.getMessage(), e);
    }
  }
}
