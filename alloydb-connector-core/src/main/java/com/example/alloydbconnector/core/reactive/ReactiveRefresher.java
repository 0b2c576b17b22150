package com.example.alloydbconnector.core.reactive;

import com.example.alloydbconnector.core.InstanceUri;
import com.example.alloydbconnector.core.RefreshContext;
import com.example.alloydbconnector.core.RefreshResult;
import com.example.alloydbconnector.core.Refresher;
import java.security.KeyPair;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Reactor front door onto a {@link Refresher}, for dialers built on non-blocking drivers.
 *
 * <pre>{@code
 * var reactive = new ReactiveRefresher(refresher);
 * reactive.refresh(instance, keyPair)
 *     .flatMap(result -> connect(result.ipAddress(), result.tlsConfig()))
 *     .subscribe();
 * }</pre>
 */
public final class ReactiveRefresher {

  private final Refresher refresher;
  private final Scheduler scheduler;

  public ReactiveRefresher(final Refresher refresher) {
    this(refresher, Schedulers.boundedElastic());
  }

  public ReactiveRefresher(final Refresher refresher, final Scheduler scheduler) {
    this.refresher = refresher;
    this.scheduler = scheduler;
  }

  /**
   * Performs one refresh per subscription, off the subscriber's thread. Cancelling the
   * subscription cancels the refresh.
   *
   * @param instance instance to refresh
   * @param keyPair RSA key pair the client certificate is issued for
   * @return the refresh result, or the refresher's exception as error signal
   */
  public Mono<RefreshResult> refresh(final InstanceUri instance, final KeyPair keyPair) {
    return Mono.using(
        RefreshContext::background,
        ctx ->
            Mono.fromCallable(() -> refresher.performRefresh(ctx, instance, keyPair))
                .subscribeOn(scheduler),
        RefreshContext::cancel);
  }
}
