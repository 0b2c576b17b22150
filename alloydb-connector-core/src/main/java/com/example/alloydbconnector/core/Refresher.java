package com.example.alloydbconnector.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.alloydbconnector.core.api.AdminApiClient;
import com.example.alloydbconnector.core.errors.DialException;
import com.example.alloydbconnector.core.errors.RefreshException;
import com.example.alloydbconnector.core.tls.TlsConfigFactory;
import com.example.alloydbconnector.core.trace.Tracer;
import java.security.KeyPair;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Obtains fresh connection metadata and an ephemeral client certificate for an AlloyDB instance
 * and turns them into a {@link RefreshResult}.
 *
 * <p>Each refresh is bounded by a timeout and admitted by a token bucket, so that a dialer
 * refreshing many instances cannot exhaust the admin API quota. Metadata and certificate are
 * fetched concurrently. A refresh is attempted exactly once; retry policy belongs to the caller.
 *
 * <p>Defaults can be supplied via system properties or environment variables:
 *
 * <ul>
 *   <li>alloydb.refresh.timeout.millis / ALLOYDB_REFRESH_TIMEOUT_MILLIS (default 60000)
 *   <li>alloydb.refresh.interval.millis / ALLOYDB_REFRESH_INTERVAL_MILLIS (default 30000)
 *   <li>alloydb.refresh.burst / ALLOYDB_REFRESH_BURST (default 2)
 * </ul>
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var refresher = Refresher.builder()
 *     .client(HttpAdminApiClient.builder().tokenSupplier(tokens).build())
 *     .build();
 *
 * var result = refresher.performRefresh(
 *     RefreshContext.background(),
 *     InstanceUri.parse("projects/p/locations/r/clusters/c/instances/i"),
 *     keyPair);
 *
 * try (var socket = result.tlsConfig().createSocket(result.ipAddress(), 5433)) {
 *   socket.startHandshake();
 * }
 * }</pre>
 *
 * <h2>Full Configuration</h2>
 *
 * <pre>{@code
 * var refresher = Refresher.builder()
 *     .client(adminApiClient)
 *     .timeout(Duration.ofSeconds(30))
 *     .refreshInterval(Duration.ofSeconds(30))
 *     .burst(2)
 *     .dialerId(dialerId)
 *     .tracer(new OpenTelemetryTracer(openTelemetry))
 *     .build();
 * }</pre>
 */
public final class Refresher {

  private static final System.Logger logger = System.getLogger(Refresher.class.getName());

  static final String SPAN_NAME = "alloydb.connector.RefreshConnection";

  static final long DEFAULT_TIMEOUT_MILLIS = 60_000L;
  static final long DEFAULT_INTERVAL_MILLIS = 30_000L;
  static final int DEFAULT_BURST = 2;

  private static final AtomicInteger THREAD_COUNT = new AtomicInteger();
  private static final Executor DEFAULT_EXECUTOR =
      Executors.newCachedThreadPool(
          r -> {
            final var t = new Thread(r, "alloydb-refresh-" + THREAD_COUNT.incrementAndGet());
            t.setDaemon(true);
            return t;
          });

  private final Duration timeout;
  private final TokenBucketRateLimiter rateLimiter;
  private final String dialerId;
  private final Tracer tracer;
  private final Executor executor;
  private final MetadataFetcher metadataFetcher;
  private final EphemeralCertificateFetcher certificateFetcher;

  private Refresher(final Builder builder) {
    this.timeout = builder.timeout;
    this.rateLimiter =
        Optional.ofNullable(builder.rateLimiter)
            .orElseGet(() -> new TokenBucketRateLimiter(builder.refreshInterval, builder.burst));
    this.dialerId = builder.dialerId;
    this.tracer = builder.tracer;
    this.executor = builder.executor;
    this.metadataFetcher = new MetadataFetcher(builder.client, builder.tracer);
    this.certificateFetcher = new EphemeralCertificateFetcher(builder.client, builder.tracer);
  }

  /**
   * Creates a new builder instance.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link Refresher} instances. */
  public static class Builder {
    private AdminApiClient client;
    private Duration timeout =
        Duration.ofMillis(
            longSetting(
                "alloydb.refresh.timeout.millis",
                "ALLOYDB_REFRESH_TIMEOUT_MILLIS",
                DEFAULT_TIMEOUT_MILLIS));
    private Duration refreshInterval =
        Duration.ofMillis(
            longSetting(
                "alloydb.refresh.interval.millis",
                "ALLOYDB_REFRESH_INTERVAL_MILLIS",
                DEFAULT_INTERVAL_MILLIS));
    private int burst =
        (int) longSetting("alloydb.refresh.burst", "ALLOYDB_REFRESH_BURST", DEFAULT_BURST);
    private TokenBucketRateLimiter rateLimiter;
    private String dialerId = UUID.randomUUID().toString();
    private Tracer tracer = Tracer.noop();
    private Executor executor = DEFAULT_EXECUTOR;

    private Builder() {}

    /**
     * Sets the admin API client (required). It is shared by concurrent refreshes.
     *
     * @param client admin API client
     * @return this builder
     */
    public Builder client(final AdminApiClient client) {
      this.client = client;
      return this;
    }

    /**
     * Sets the maximum time one refresh may take, including the wait for a rate limiter token.
     *
     * <p>Default: 60 seconds
     *
     * @param timeout per-refresh timeout
     * @return this builder
     */
    public Builder timeout(final Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    /**
     * Sets how often a token is added to the rate limiter. Ignored when {@link
     * #rateLimiter(TokenBucketRateLimiter)} is set.
     *
     * <p>Default: 30 seconds
     *
     * @param refreshInterval refill interval
     * @return this builder
     */
    public Builder refreshInterval(final Duration refreshInterval) {
      this.refreshInterval = refreshInterval;
      return this;
    }

    /**
     * Sets how many refreshes may run back to back before the interval applies. Ignored when
     * {@link #rateLimiter(TokenBucketRateLimiter)} is set.
     *
     * <p>Default: 2
     *
     * @param burst rate limiter capacity
     * @return this builder
     */
    public Builder burst(final int burst) {
      this.burst = burst;
      return this;
    }

    /**
     * Uses an existing limiter instead of creating one from interval and burst.
     *
     * @param rateLimiter limiter owned by this refresher
     * @return this builder
     */
    public Builder rateLimiter(final TokenBucketRateLimiter rateLimiter) {
      this.rateLimiter = rateLimiter;
      return this;
    }

    /**
     * Sets the id of the dialer owning this refresher, reported with every refresh.
     *
     * <p>Default: a random UUID
     *
     * @param dialerId dialer id
     * @return this builder
     */
    public Builder dialerId(final String dialerId) {
      this.dialerId = dialerId;
      return this;
    }

    /** Sets the tracer receiving refresh spans and metrics. Default: {@link Tracer#noop()}. */
    public Builder tracer(final Tracer tracer) {
      this.tracer = tracer;
      return this;
    }

    /**
     * Sets the executor running the two fetches and the outcome report.
     *
     * <p>Default: a shared pool of daemon threads
     *
     * @param executor task executor
     * @return this builder
     */
    public Builder executor(final Executor executor) {
      this.executor = executor;
      return this;
    }

    /**
     * Builds the Refresher instance.
     *
     * @return configured Refresher
     * @throws IllegalStateException if required fields are not set
     */
    public Refresher build() {
      if (client == null) throw new IllegalStateException("client is required");
      if (timeout == null || timeout.isNegative() || timeout.isZero())
        throw new IllegalArgumentException("timeout must be positive");
      if (rateLimiter == null) {
        if (refreshInterval == null || refreshInterval.isNegative() || refreshInterval.isZero())
          throw new IllegalArgumentException("refreshInterval must be positive");
        if (burst < 1) throw new IllegalArgumentException("burst must be >= 1");
      }
      if (dialerId == null || dialerId.isBlank())
        throw new IllegalStateException("dialerId cannot be blank");
      if (tracer == null) throw new IllegalStateException("tracer cannot be null");
      if (executor == null) throw new IllegalStateException("executor cannot be null");
      return new Refresher(this);
    }
  }

  /**
   * Performs one refresh.
   *
   * <p>Waits for a rate limiter token, then fetches metadata and a client certificate for {@code
   * keyPair} concurrently and builds the TLS configuration. The whole operation, including the
   * token wait, is bounded by the configured timeout and by {@code ctx}. When it gives up early,
   * fetches still in flight are abandoned and their results dropped.
   *
   * @param ctx parent context; cancelling it aborts the refresh
   * @param instance instance to refresh
   * @param keyPair RSA key pair the client certificate is issued for; not modified
   * @return address, TLS configuration and certificate expiry
   * @throws CancellationException if {@code ctx} was already cancelled; nothing is attempted
   * @throws DialException if no rate limiter token could be had before the deadline
   * @throws RefreshException if a fetch failed or the deadline passed while fetching
   */
  public RefreshResult performRefresh(
      final RefreshContext ctx, final InstanceUri instance, final KeyPair keyPair) {
    final var uri = instance.toString();
    final var end =
        tracer.startSpan(
            SPAN_NAME,
            Map.of(Tracer.INSTANCE_ATTRIBUTE, uri, Tracer.DIALER_ID_ATTRIBUTE, dialerId));
    final var refreshCtx = ctx.withTimeout(timeout);

    RuntimeException failure = null;
    try {
      return refresh(refreshCtx, instance, keyPair);
    } catch (final RuntimeException e) {
      failure = e;
      throw e;
    } finally {
      refreshCtx.cancel();
      report(uri, failure);
      end.end(failure);
    }
  }

  /** Returns the id reported with every refresh. */
  public String dialerId() {
    return dialerId;
  }

  /** Returns the overall limit applied to each refresh. */
  public Duration timeout() {
    return timeout;
  }

  private RefreshResult refresh(
      final RefreshContext ctx, final InstanceUri instance, final KeyPair keyPair) {
    final var uri = instance.toString();
    if (ctx.isCancelled()) throw ctx.error().orElseThrow();

    if (!rateLimiter.acquire(ctx))
      throw new DialException("refresh was throttled until context expired", uri, null);

    logger.log(DEBUG, "Refreshing {0}", uri);
    final var metadata =
        CompletableFuture.supplyAsync(() -> metadataFetcher.fetch(ctx, instance), executor);
    final var certificates =
        CompletableFuture.supplyAsync(
            () -> certificateFetcher.fetch(ctx, instance, keyPair), executor);

    final var info = await(ctx, metadata, "failed to get instance IP address", uri);
    final var chain = await(ctx, certificates, "fetch ephemeral cert failed", uri);

    final var tlsConfig = TlsConfigFactory.create(instance, chain, info, keyPair);
    final var expiry =
        tlsConfig.leaf().map(leaf -> leaf.getNotAfter().toInstant()).orElse(Instant.EPOCH);
    logger.log(DEBUG, "Refreshed {0}, client certificate expires at {1}", uri, expiry);
    return new RefreshResult(info.ipAddress(), tlsConfig, expiry);
  }

  private static <T> T await(
      final RefreshContext ctx,
      final CompletableFuture<T> future,
      final String message,
      final String uri) {
    try {
      return ctx.await(future);
    } catch (final ExecutionException e) {
      throw new RefreshException(message, uri, e.getCause());
    } catch (final CancellationException e) {
      throw new RefreshException("refresh failed", uri, e);
    }
  }

  private void report(final String uri, final Throwable failure) {
    try {
      CompletableFuture.runAsync(() -> tracer.recordRefreshResult(uri, dialerId, failure), executor)
          .whenComplete(
              (ignored, e) -> {
                if (e != null) logger.log(WARNING, "Failed to record refresh result for " + uri, e);
              });
    } catch (final RejectedExecutionException e) {
      logger.log(WARNING, "Failed to record refresh result for " + uri, e);
    }
  }

  private static long longSetting(final String property, final String env, final long fallback) {
    return Optional.ofNullable(System.getProperty(property))
        .or(() -> Optional.ofNullable(System.getenv(env)))
        .filter(val -> !val.isBlank())
        .map(String::trim)
        .flatMap(
            val -> {
              try {
                return Optional.of(Long.parseLong(val));
              } catch (final NumberFormatException e) {
                logger.log(WARNING, "Ignoring non-numeric {0}={1}", property, val);
                return Optional.empty();
              }
            })
        .orElse(fallback);
  }
}
