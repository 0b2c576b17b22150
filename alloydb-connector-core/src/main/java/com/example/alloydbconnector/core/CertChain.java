package com.example.alloydbconnector.core;

import java.security.cert.X509Certificate;

/**
 * Ephemeral client identity issued by the admin API.
 *
 * @param root trust anchor for the instance's server certificate
 * @param intermediate CA certificate that signed {@code client}, presented alongside it
 * @param client short-lived client certificate bound to the caller's key pair
 */
public record CertChain(X509Certificate root, X509Certificate intermediate, X509Certificate client) {}
