package com.example.alloydbconnector.core;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Token bucket limiting how often a {@link Refresher} may call the admin API.
 *
 * <p>One token is added per interval up to {@code burst}; the bucket starts full. Each refresh
 * takes a token. Callers that find the bucket empty reserve a future token and wait for it, so
 * admission follows reservation order.
 */
public final class TokenBucketRateLimiter {

  private final long intervalNanos;
  private final int burst;
  private final LongSupplier nanoClock;

  private double tokens;
  private long last;

  /**
   * @param interval time to refill one token, must be positive
   * @param burst bucket capacity, must be at least 1
   */
  public TokenBucketRateLimiter(final Duration interval, final int burst) {
    this(interval, burst, System::nanoTime);
  }

  TokenBucketRateLimiter(final Duration interval, final int burst, final LongSupplier nanoClock) {
    if (interval == null || interval.isNegative() || interval.isZero())
      throw new IllegalArgumentException("interval must be positive");
    if (burst < 1) throw new IllegalArgumentException("burst must be >= 1");
    this.intervalNanos = interval.toNanos();
    this.burst = burst;
    this.nanoClock = nanoClock;
    this.tokens = burst;
    this.last = nanoClock.getAsLong();
  }

  /**
   * Takes a token, waiting for one if necessary.
   *
   * <p>Returns immediately with {@code false} when the context is already done or when the token
   * would only become available after the context's deadline. If the context finishes during the
   * wait the reservation is handed back.
   *
   * @param ctx bounds the wait
   * @return true if a token was taken
   */
  public boolean acquire(final RefreshContext ctx) {
    final long waitNanos;
    synchronized (this) {
      if (ctx.isDone()) return false;

      advance(nanoClock.getAsLong());
      tokens -= 1;
      waitNanos = tokens < 0 ? (long) Math.ceil(-tokens * intervalNanos) : 0L;

      final var remaining = ctx.remaining();
      if (remaining.isPresent() && waitNanos > remaining.get().toNanos()) {
        tokens += 1;
        return false;
      }
    }

    if (waitNanos == 0L || ctx.sleep(Duration.ofNanos(waitNanos))) return true;

    synchronized (this) {
      tokens = Math.min(burst, tokens + 1);
    }
    return false;
  }

  /** Returns the tokens available right now, for diagnostics. */
  public synchronized double availableTokens() {
    advance(nanoClock.getAsLong());
    return tokens;
  }

  private void advance(final long now) {
    final var elapsed = Math.max(0L, now - last);
    tokens = Math.min(burst, tokens + (double) elapsed / intervalNanos);
    last = now;
  }
}
