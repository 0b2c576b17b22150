package com.example.alloydbconnector.core;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Cancellable, deadline-bound scope for a single refresh.
 *
 * <p>A context finishes exactly once, either because {@link #cancel()} was called or because its
 * deadline passed. Children created with {@link #withTimeout(Duration)} finish when their parent
 * does, and never outlive the parent's deadline.
 *
 * <pre>{@code
 * var ctx = RefreshContext.background().withTimeout(Duration.ofSeconds(30));
 * try {
 *   var result = refresher.performRefresh(ctx, instance, keyPair);
 * } finally {
 *   ctx.cancel();
 * }
 * }</pre>
 */
public final class RefreshContext {

  private final Long deadlineNanos;
  private final RefreshContext parent;
  // Callbacks run once on finish; children and waiters remove their own when they are done.
  private final Set<Runnable> listeners = ConcurrentHashMap.newKeySet();
  private final Runnable parentListener = this::onParentDone;
  private volatile CancellationException error;

  private RefreshContext(final Long deadlineNanos, final RefreshContext parent) {
    this.deadlineNanos = deadlineNanos;
    this.parent = parent;
  }

  /**
   * Creates a root context with no deadline. It only finishes when cancelled.
   *
   * @return new root context
   */
  public static RefreshContext background() {
    return new RefreshContext(null, null);
  }

  /**
   * Derives a child context that finishes after {@code timeout}, when this context finishes, or
   * when it is cancelled itself, whichever comes first.
   *
   * @param timeout maximum lifetime of the child, must not be negative
   * @return child context
   */
  public RefreshContext withTimeout(final Duration timeout) {
    if (timeout == null || timeout.isNegative())
      throw new IllegalArgumentException("timeout must be non-negative");

    final var candidate = System.nanoTime() + timeout.toNanos();
    final var childDeadline =
        deadlineNanos == null || deadlineNanos - candidate > 0 ? candidate : deadlineNanos;
    final var child = new RefreshContext(childDeadline, this);

    if (!addListener(child.parentListener)) child.finish(error);
    else child.scheduleExpiry();
    return child;
  }

  /** Cancels this context and every context derived from it. */
  public void cancel() {
    finish(new CancellationException("context canceled"));
  }

  /** Returns whether the context has finished, through cancellation or deadline. */
  public boolean isDone() {
    return error != null;
  }

  /** Returns whether the context finished through {@link #cancel()} rather than its deadline. */
  public boolean isCancelled() {
    final var e = error;
    return e != null && !(e instanceof DeadlineExceededException);
  }

  /**
   * Returns why the context finished.
   *
   * @return {@link DeadlineExceededException} after the deadline, a plain {@link
   *     CancellationException} after cancellation, or empty while still running
   */
  public Optional<CancellationException> error() {
    return Optional.ofNullable(error);
  }

  /**
   * Returns the time left before the deadline.
   *
   * @return remaining time, never negative, or empty when the context has no deadline
   */
  public Optional<Duration> remaining() {
    if (deadlineNanos == null) return Optional.empty();
    return Optional.of(Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime())));
  }

  /**
   * Waits for {@code future} or for this context to finish, whichever happens first.
   *
   * <p>The future is never cancelled: when the context wins the race it keeps running and its
   * outcome is dropped.
   *
   * @param future the result to wait for
   * @param <T> result type
   * @return the future's value
   * @throws ExecutionException if the future completed exceptionally first
   * @throws CancellationException if the context finished first
   */
  public <T> T await(final CompletableFuture<T> future) throws ExecutionException {
    final var latch = new CountDownLatch(1);
    final Runnable wake = latch::countDown;
    future.whenComplete((v, t) -> latch.countDown());
    if (addListener(wake)) {
      try {
        latch.await();
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        cancel();
      } finally {
        listeners.remove(wake);
      }
    }

    if (future.isDone()) {
      try {
        return future.get();
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        cancel();
      }
    }
    throw error;
  }

  /**
   * Blocks for {@code duration} unless the context finishes first.
   *
   * @param duration how long to wait
   * @return true if the full duration elapsed, false if the context finished first
   */
  public boolean sleep(final Duration duration) {
    if (isDone()) return false;
    final var latch = new CountDownLatch(1);
    final Runnable wake = latch::countDown;
    if (!addListener(wake)) return false;
    try {
      return !latch.await(duration.toNanos(), TimeUnit.NANOSECONDS) && !isDone();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      cancel();
      return false;
    } finally {
      listeners.remove(wake);
    }
  }

  /** Number of callbacks waiting on this context. */
  int listenerCount() {
    return listeners.size();
  }

  private synchronized boolean addListener(final Runnable listener) {
    if (error != null) return false;
    listeners.add(listener);
    return true;
  }

  private void onParentDone() {
    finish(parent.error);
  }

  private void scheduleExpiry() {
    final var remaining = deadlineNanos - System.nanoTime();
    if (remaining <= 0) {
      finish(new DeadlineExceededException());
      return;
    }
    CompletableFuture.delayedExecutor(remaining, TimeUnit.NANOSECONDS)
        .execute(() -> finish(new DeadlineExceededException()));
  }

  private void finish(final CancellationException cause) {
    final ArrayList<Runnable> pending;
    synchronized (this) {
      if (error != null) return;
      error = cause;
      pending = new ArrayList<>(listeners);
      listeners.clear();
    }
    if (parent != null) parent.listeners.remove(parentListener);
    pending.forEach(Runnable::run);
  }
}
