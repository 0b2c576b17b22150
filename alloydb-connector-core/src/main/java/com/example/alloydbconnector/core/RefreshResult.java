package com.example.alloydbconnector.core;

import com.example.alloydbconnector.core.tls.TlsConfig;
import java.time.Instant;

/**
 * Outcome of one successful refresh, handed to the dialer.
 *
 * @param ipAddress address to dial
 * @param tlsConfig TLS configuration carrying the fresh client identity
 * @param expiry {@code NotAfter} of the client certificate inside {@code tlsConfig}, or {@link
 *     Instant#EPOCH} when it carries none
 */
public record RefreshResult(String ipAddress, TlsConfig tlsConfig, Instant expiry) {}
