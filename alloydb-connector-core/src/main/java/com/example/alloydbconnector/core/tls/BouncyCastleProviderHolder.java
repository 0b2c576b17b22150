package com.example.alloydbconnector.core.tls;

import org.bouncycastle.jce.provider.BouncyCastleProvider;

/** Shared BouncyCastle provider; not registered globally. */
final class BouncyCastleProviderHolder {

  private static final BouncyCastleProvider bcProvider = new BouncyCastleProvider();

  private BouncyCastleProviderHolder() {}

  static BouncyCastleProvider getInstance() {
    return bcProvider;
  }
}
