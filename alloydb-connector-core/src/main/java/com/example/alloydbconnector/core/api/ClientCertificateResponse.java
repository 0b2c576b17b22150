package com.example.alloydbconnector.core.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Response of the {@code generateClientCertificate} method.
 *
 * @param pemCertificate the signed client certificate
 * @param pemCertificateChain issuing chain, intermediate first and root last
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClientCertificateResponse(String pemCertificate, List<String> pemCertificateChain) {

  public ClientCertificateResponse {
    pemCertificateChain = pemCertificateChain == null ? List.of() : List.copyOf(pemCertificateChain);
  }
}
