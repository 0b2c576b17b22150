/**
 * Refresh of AlloyDB connection material.
 *
 * <p>A dialer periodically asks a {@link com.example.alloydbconnector.core.Refresher} for fresh
 * connection material for an instance: its current IP address and a TLS configuration carrying a
 * short-lived client certificate. The TLS configuration accepts only the instance's own server
 * certificate, identified by the instance UID in its common name.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.alloydbconnector.core.InstanceUri} – address of an instance.
 *   <li>{@link com.example.alloydbconnector.core.RefreshContext} – cancellable, deadline-bound
 *       scope of one refresh.
 *   <li>{@link com.example.alloydbconnector.core.TokenBucketRateLimiter} – limits how often a
 *       refresher calls the admin API.
 *   <li>{@link com.example.alloydbconnector.core.Refresher} – runs one refresh.
 *   <li>{@link com.example.alloydbconnector.core.api.AdminApiClient} – the admin API methods a
 *       refresh uses, with an HTTP implementation.
 *   <li>{@link com.example.alloydbconnector.core.tls.TlsConfigFactory} – builds the TLS
 *       configuration and its peer verification.
 *   <li>{@link com.example.alloydbconnector.core.trace.Tracer} – spans and refresh counts.
 *   <li>{@link com.example.alloydbconnector.core.reactive.ReactiveRefresher} – Reactor adapter.
 * </ul>
 */
package com.example.alloydbconnector.core;
