package com.example.alloydbconnector.core.tls;

import java.security.cert.CertificateException;

/** The input holds no complete, decodable PEM block. */
public final class InvalidPemException extends CertificateException {

  private static final long serialVersionUID = 1L;

  static final String MESSAGE = "certificate is not a valid PEM";

  InvalidPemException() {
    super(MESSAGE);
  }

  InvalidPemException(final Throwable cause) {
    super(MESSAGE, cause);
  }
}
