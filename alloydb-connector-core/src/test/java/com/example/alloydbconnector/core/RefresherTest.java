package com.example.alloydbconnector.core;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isA;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

import com.example.alloydbconnector.core.api.AdminApiClient;
import com.example.alloydbconnector.core.api.AdminApiException;
import com.example.alloydbconnector.core.api.ClientCertificateResponse;
import com.example.alloydbconnector.core.api.ConnectionInfo;
import com.example.alloydbconnector.core.errors.DialException;
import com.example.alloydbconnector.core.errors.RefreshException;
import com.example.alloydbconnector.core.tls.PemCertificates;
import com.example.alloydbconnector.core.trace.EndSpan;
import com.example.alloydbconnector.core.trace.Tracer;
import java.security.KeyPair;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class RefresherTest {

  private static final InstanceUri INSTANCE =
      InstanceUri.parse("projects/my-project/locations/us-central1/clusters/c1/instances/i1");
  private static final String URI = INSTANCE.toString();
  private static final String DIALER_ID = "dialer-1";

  private TestAuthority authority;
  private KeyPair keyPair;
  private AdminApiClient client;

  @BeforeAll
  void createAuthority() {
    authority = TestAuthority.create();
    keyPair = TestAuthority.sharedKeyPair();
  }

  @BeforeEach
  void setUp() {
    client = mock(AdminApiClient.class);
  }

  private void answerNormally() {
    when(client.connectionInfo(any(), eq("my-project"), eq("us-central1"), eq("c1"), eq("i1")))
        .thenReturn(new ConnectionInfo("10.1.2.3", "f00d"));
    when(client.generateClientCertificate(
            any(), eq("my-project"), eq("us-central1"), eq("c1"), eq("i1"), anyString()))
        .thenAnswer(inv -> authority.respond(inv.getArgument(5)));
  }

  private Refresher.Builder refresher() {
    return Refresher.builder().client(client).dialerId(DIALER_ID);
  }

  @Nested
  @DisplayName("Successful refresh")
  class Success {

    @Test
    @DisplayName("Returns the address, a TLS configuration and the client certificate's expiry")
    void shouldReturnResult() {
      answerNormally();

      final var result =
          refresher().build().performRefresh(RefreshContext.background(), INSTANCE, keyPair);

      assertEquals("10.1.2.3", result.ipAddress());
      assertEquals(authority.lastClientCertificate().getNotAfter().toInstant(), result.expiry());
      assertEquals(authority.lastClientCertificate(), result.tlsConfig().leaf().orElseThrow());
      assertEquals(authority.root(), result.tlsConfig().root());
    }

    @Test
    @DisplayName("Fetches metadata and certificate concurrently")
    void shouldFetchConcurrently() {
      final var barrier = new CyclicBarrier(2);
      when(client.connectionInfo(any(), any(), any(), any(), any()))
          .thenAnswer(
              inv -> {
                barrier.await(5, TimeUnit.SECONDS);
                return new ConnectionInfo("10.1.2.3", "f00d");
              });
      when(client.generateClientCertificate(any(), any(), any(), any(), any(), anyString()))
          .thenAnswer(
              inv -> {
                barrier.await(5, TimeUnit.SECONDS);
                return authority.respond(inv.getArgument(5));
              });

      final var result =
          refresher().build().performRefresh(RefreshContext.background(), INSTANCE, keyPair);

      assertEquals("10.1.2.3", result.ipAddress());
    }

    @Test
    @DisplayName("Finishes the context handed to the client once the refresh returns")
    void shouldFinishFetchContext() {
      final var seen = new AtomicReference<RefreshContext>();
      when(client.connectionInfo(any(), any(), any(), any(), any()))
          .thenAnswer(
              inv -> {
                seen.set(inv.getArgument(0));
                return new ConnectionInfo("10.1.2.3", "f00d");
              });
      when(client.generateClientCertificate(any(), any(), any(), any(), any(), anyString()))
          .thenAnswer(inv -> authority.respond(inv.getArgument(5)));
      final var parent = RefreshContext.background();

      refresher().build().performRefresh(parent, INSTANCE, keyPair);

      assertTrue(seen.get().isDone());
      assertFalse(parent.isDone());
    }

    @Test
    void shouldBoundFetchContextByTimeout() {
      final var seen = new AtomicReference<Duration>();
      when(client.connectionInfo(any(), any(), any(), any(), any()))
          .thenAnswer(
              inv -> {
                seen.set(((RefreshContext) inv.getArgument(0)).remaining().orElseThrow());
                return new ConnectionInfo("10.1.2.3", "f00d");
              });
      when(client.generateClientCertificate(any(), any(), any(), any(), any(), anyString()))
          .thenAnswer(inv -> authority.respond(inv.getArgument(5)));

      refresher()
          .timeout(Duration.ofSeconds(20))
          .build()
          .performRefresh(RefreshContext.background(), INSTANCE, keyPair);

      assertTrue(seen.get().compareTo(Duration.ofSeconds(20)) <= 0);
      assertTrue(seen.get().compareTo(Duration.ofSeconds(10)) > 0);
    }
  }

  @Nested
  @DisplayName("Admission")
  class Admission {

    @Test
    @DisplayName("Cancelled context fails immediately without calling the admin API")
    void shouldFailFastOnCancelledContext() {
      final var ctx = RefreshContext.background();
      ctx.cancel();

      final var e =
          assertThrows(
              CancellationException.class,
              () -> refresher().build().performRefresh(ctx, INSTANCE, keyPair));

      assertEquals("context canceled", e.getMessage());
      verifyNoInteractions(client);
    }

    @Test
    @DisplayName("Throttles once the bucket is empty and the next token is past the deadline")
    void shouldThrottle() {
      answerNormally();
      final var refresher =
          refresher()
              .timeout(Duration.ofSeconds(5))
              .rateLimiter(new TokenBucketRateLimiter(Duration.ofHours(1), 1))
              .build();
      refresher.performRefresh(RefreshContext.background(), INSTANCE, keyPair);

      final var e =
          assertThrows(
              DialException.class,
              () -> refresher.performRefresh(RefreshContext.background(), INSTANCE, keyPair));

      assertEquals(
          "Dial error: refresh was throttled until context expired (instance URI = \""
              + URI
              + "\")",
          e.getMessage());
      verify(client, times(1)).connectionInfo(any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("A parent past its deadline is reported as throttled, not cancelled")
    void shouldReportExpiredParentAsThrottled() {
      final var expired = RefreshContext.background().withTimeout(Duration.ZERO);

      assertThrows(
          DialException.class,
          () -> refresher().build().performRefresh(expired, INSTANCE, keyPair));
      verifyNoInteractions(client);
    }

    @Test
    void burstAllowsBackToBackRefreshes() {
      answerNormally();
      final var refresher = refresher().refreshInterval(Duration.ofHours(1)).burst(2).build();

      refresher.performRefresh(RefreshContext.background(), INSTANCE, keyPair);
      refresher.performRefresh(RefreshContext.background(), INSTANCE, keyPair);

      verify(client, times(2)).connectionInfo(any(), any(), any(), any(), any());
    }
  }

  @Nested
  @DisplayName("Failures")
  class Failures {

    @Test
    void shouldReportMetadataFailure() {
      when(client.connectionInfo(any(), any(), any(), any(), any()))
          .thenThrow(new AdminApiException(404, "not found"));
      when(client.generateClientCertificate(any(), any(), any(), any(), any(), anyString()))
          .thenAnswer(inv -> authority.respond(inv.getArgument(5)));

      final var e =
          assertThrows(
              RefreshException.class,
              () ->
                  refresher()
                      .build()
                      .performRefresh(RefreshContext.background(), INSTANCE, keyPair));

      assertTrue(
          e.getMessage()
              .startsWith(
                  "Refresh error: failed to get instance IP address (instance URI = \""
                      + URI
                      + "\"): Refresh error: failed to get instance metadata"));
      assertTrue(e.getMessage().endsWith("admin API returned HTTP 404: not found"));
      assertEquals(URI, e.getInstanceUri());
    }

    @Test
    void shouldReportCertificateFailure() {
      when(client.connectionInfo(any(), any(), any(), any(), any()))
          .thenReturn(new ConnectionInfo("10.1.2.3", "f00d"));
      when(client.generateClientCertificate(any(), any(), any(), any(), any(), anyString()))
          .thenReturn(
              new ClientCertificateResponse(
                  PemCertificates.toPem(authority.intermediate()),
                  List.of(PemCertificates.toPem(authority.root()))));

      final var e =
          assertThrows(
              RefreshException.class,
              () ->
                  refresher()
                      .build()
                      .performRefresh(RefreshContext.background(), INSTANCE, keyPair));

      assertTrue(e.getMessage().startsWith("Refresh error: fetch ephemeral cert failed"));
      assertTrue(e.getMessage().contains("missing instance and root certificates"));
    }

    @Test
    @DisplayName("Deadline passing while fetching fails the refresh")
    void shouldFailWhenDeadlinePassesWhileFetching() {
      final var hold = new CountDownLatch(1);
      when(client.connectionInfo(any(), any(), any(), any(), any()))
          .thenAnswer(
              inv -> {
                hold.await(1, TimeUnit.MINUTES);
                throw new AdminApiException("aborted", null);
              });
      when(client.generateClientCertificate(any(), any(), any(), any(), any(), anyString()))
          .thenAnswer(inv -> authority.respond(inv.getArgument(5)));

      final var start = System.nanoTime();
      final RefreshException e;
      try {
        e =
            assertThrows(
                RefreshException.class,
                () ->
                    refresher()
                        .timeout(Duration.ofMillis(200))
                        .build()
                        .performRefresh(RefreshContext.background(), INSTANCE, keyPair));
      } finally {
        hold.countDown();
      }

      assertEquals(
          "Refresh error: refresh failed (instance URI = \""
              + URI
              + "\"): context deadline exceeded",
          e.getMessage());
      assertInstanceOf(DeadlineExceededException.class, e.getCause());
      assertTrue(Duration.ofNanos(System.nanoTime() - start).compareTo(Duration.ofSeconds(30)) < 0);
    }

    @Test
    @DisplayName("Cancelling the parent while fetching fails the refresh")
    void shouldFailWhenCancelledWhileFetching() {
      final var parent = RefreshContext.background();
      final var hold = new CountDownLatch(1);
      when(client.connectionInfo(any(), any(), any(), any(), any()))
          .thenAnswer(
              inv -> {
                parent.cancel();
                hold.await(1, TimeUnit.MINUTES);
                throw new AdminApiException("aborted", null);
              });
      when(client.generateClientCertificate(any(), any(), any(), any(), any(), anyString()))
          .thenAnswer(inv -> authority.respond(inv.getArgument(5)));

      final RefreshException e;
      try {
        e =
            assertThrows(
                RefreshException.class,
                () -> refresher().build().performRefresh(parent, INSTANCE, keyPair));
      } finally {
        hold.countDown();
      }

      assertTrue(e.getMessage().startsWith("Refresh error: refresh failed"));
      assertTrue(e.getMessage().endsWith("context canceled"));
    }
  }

  @Nested
  @DisplayName("Tracing")
  class Tracing {

    private Tracer tracer;
    private EndSpan endSpan;

    @BeforeEach
    void mockTracer() {
      tracer = mock(Tracer.class);
      endSpan = mock(EndSpan.class);
      when(tracer.startSpan(anyString(), anyMap())).thenReturn(endSpan);
    }

    @Test
    @DisplayName("Opens a span per refresh and per fetch and reports success asynchronously")
    void shouldTraceSuccess() {
      answerNormally();

      refresher()
          .tracer(tracer)
          .build()
          .performRefresh(RefreshContext.background(), INSTANCE, keyPair);

      verify(tracer)
          .startSpan(
              Refresher.SPAN_NAME,
              Map.of(Tracer.INSTANCE_ATTRIBUTE, URI, Tracer.DIALER_ID_ATTRIBUTE, DIALER_ID));
      verify(tracer).startSpan(eq(MetadataFetcher.SPAN_NAME), anyMap());
      verify(tracer).startSpan(eq(EphemeralCertificateFetcher.SPAN_NAME), anyMap());
      verify(endSpan, times(3)).end(isNull());
      verify(tracer, timeout(2_000)).recordRefreshResult(URI, DIALER_ID, null);
    }

    @Test
    void shouldTraceFailure() {
      when(client.connectionInfo(any(), any(), any(), any(), any()))
          .thenThrow(new AdminApiException(503, "unavailable"));
      when(client.generateClientCertificate(any(), any(), any(), any(), any(), anyString()))
          .thenAnswer(inv -> authority.respond(inv.getArgument(5)));

      final var e =
          assertThrows(
              RefreshException.class,
              () ->
                  refresher()
                      .tracer(tracer)
                      .build()
                      .performRefresh(RefreshContext.background(), INSTANCE, keyPair));

      verify(endSpan).end(e);
      verify(tracer, timeout(2_000))
          .recordRefreshResult(eq(URI), eq(DIALER_ID), isA(RefreshException.class));
    }

    @Test
    @DisplayName("Returns without waiting for the outcome report")
    void shouldNotWaitForReport() throws Exception {
      answerNormally();
      final var release = new CountDownLatch(1);
      doAnswer(
              inv -> {
                release.await(10, TimeUnit.SECONDS);
                return null;
              })
          .when(tracer)
          .recordRefreshResult(anyString(), anyString(), any());

      try {
        final var result =
            refresher()
                .tracer(tracer)
                .build()
                .performRefresh(RefreshContext.background(), INSTANCE, keyPair);
        assertEquals("10.1.2.3", result.ipAddress());
      } finally {
        release.countDown();
      }
    }
  }

  @Nested
  @DisplayName("Builder")
  class BuilderValidation {

    @Test
    void shouldRequireClient() {
      assertThrows(IllegalStateException.class, () -> Refresher.builder().build());
    }

    @Test
    void shouldRejectNonPositiveDurations() {
      assertThrows(
          IllegalArgumentException.class, () -> refresher().timeout(Duration.ZERO).build());
      assertThrows(
          IllegalArgumentException.class,
          () -> refresher().refreshInterval(Duration.ofSeconds(-1)).build());
      assertThrows(IllegalArgumentException.class, () -> refresher().burst(0).build());
    }

    @Test
    void shouldRejectBlankDialerIdAndNulls() {
      assertThrows(IllegalStateException.class, () -> refresher().dialerId(" ").build());
      assertThrows(IllegalStateException.class, () -> refresher().tracer(null).build());
      assertThrows(IllegalStateException.class, () -> refresher().executor(null).build());
    }

    @Test
    @DisplayName("Reads defaults from system properties and ignores non-numeric values")
    void shouldReadSystemProperties() {
      System.setProperty("alloydb.refresh.timeout.millis", "1234");
      System.setProperty("alloydb.refresh.burst", "lots");
      try {
        final var refresher = refresher().build();
        assertEquals(Duration.ofMillis(1234), refresher.timeout());
      } finally {
        System.clearProperty("alloydb.refresh.timeout.millis");
        System.clearProperty("alloydb.refresh.burst");
      }
    }

    @Test
    void shouldUseDistinctDialerIdsByDefault() {
      final var a = Refresher.builder().client(client).build();
      final var b = Refresher.builder().client(client).build();

      assertNotEquals(a.dialerId(), b.dialerId());
    }

    @Test
    void shouldDefaultTimeoutToOneMinute() {
      assertEquals(Duration.ofSeconds(60), refresher().build().timeout());
    }
  }
}
