package com.example.alloydbconnector.core.api;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.alloydbconnector.core.RefreshContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * {@link AdminApiClient} speaking the AlloyDB Admin REST API over the JDK {@link HttpClient}.
 *
 * <p>The endpoint can be supplied via system property or environment variable:
 *
 * <ul>
 *   <li>alloydb.admin.endpoint / ALLOYDB_ADMIN_ENDPOINT (default {@value #DEFAULT_ENDPOINT})
 * </ul>
 *
 * <pre>{@code
 * var client = HttpAdminApiClient.builder()
 *     .tokenSupplier(() -> credentials.getAccessToken())
 *     .build();
 * }</pre>
 */
public final class HttpAdminApiClient implements AdminApiClient {

  private static final System.Logger logger = System.getLogger(HttpAdminApiClient.class.getName());

  public static final String DEFAULT_ENDPOINT = "https://alloydb.googleapis.com";

  private static final String API_VERSION = "v1beta";
  private static final String CERT_DURATION = "3600s";

  private final HttpClient httpClient;
  private final URI endpoint;
  private final Supplier<String> tokenSupplier;
  private final ObjectMapper mapper;

  private HttpAdminApiClient(final Builder builder) {
    this.httpClient = builder.httpClient;
    this.endpoint = URI.create(stripTrailingSlash(builder.endpoint));
    this.tokenSupplier = builder.tokenSupplier;
    this.mapper = builder.mapper;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link HttpAdminApiClient}. */
  public static class Builder {
    private String endpoint = defaultEndpoint();
    private Supplier<String> tokenSupplier;
    private HttpClient httpClient;
    private ObjectMapper mapper = new ObjectMapper();

    private Builder() {}

    /**
     * Overrides the API root, e.g. for a regional endpoint or a local fake.
     *
     * @param endpoint scheme and authority, optionally followed by a path prefix
     * @return this builder
     */
    public Builder endpoint(final String endpoint) {
      this.endpoint = endpoint;
      return this;
    }

    /**
     * Sets the source of OAuth2 access tokens (required). Called once per request.
     *
     * @param tokenSupplier supplies a bearer token
     * @return this builder
     */
    public Builder tokenSupplier(final Supplier<String> tokenSupplier) {
      this.tokenSupplier = tokenSupplier;
      return this;
    }

    /** Sets the HTTP client for every call. Default: one with a 30s connect timeout. */
    public Builder httpClient(final HttpClient httpClient) {
      this.httpClient = httpClient;
      return this;
    }

    /** Sets the mapper for request and response bodies. Default: a plain {@link ObjectMapper}. */
    public Builder objectMapper(final ObjectMapper mapper) {
      this.mapper = mapper;
      return this;
    }

    /**
     * Builds the client.
     *
     * @return configured client
     * @throws IllegalStateException if required fields are not set
     */
    public HttpAdminApiClient build() {
      if (endpoint == null || endpoint.isBlank())
        throw new IllegalStateException("endpoint is required");
      if (tokenSupplier == null) throw new IllegalStateException("tokenSupplier is required");
      if (mapper == null) throw new IllegalStateException("objectMapper cannot be null");
      if (httpClient == null)
        httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(30)).build();
      return new HttpAdminApiClient(this);
    }
  }

  @Override
  public ConnectionInfo connectionInfo(
      final RefreshContext ctx,
      final String project,
      final String region,
      final String cluster,
      final String name) {
    final var uri =
        resolve(
            String.format(
                "projects/%s/locations/%s/clusters/%s/instances/%s/connectionInfo",
                project, region, cluster, name));
    final var request = newRequest(ctx, uri).GET().build();
    return send(ctx, request, ConnectionInfo.class);
  }

  @Override
  public ClientCertificateResponse generateClientCertificate(
      final RefreshContext ctx,
      final String project,
      final String region,
      final String cluster,
      final String name,
      final String csrPem) {
    final var uri =
        resolve(
            String.format(
                "projects/%s/locations/%s/clusters/%s:generateClientCertificate",
                project, region, cluster));
    final String body;
    try {
      body = mapper.writeValueAsString(new GenerateClientCertificateRequest(csrPem, CERT_DURATION));
    } catch (final JsonProcessingException e) {
      throw new AdminApiException("failed to encode generateClientCertificate request", e);
    }
    final var request =
        newRequest(ctx, uri)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
    return send(ctx, request, ClientCertificateResponse.class);
  }

  private URI resolve(final String path) {
    return URI.create(endpoint + "/" + API_VERSION + "/" + path);
  }

  private HttpRequest.Builder newRequest(final RefreshContext ctx, final URI uri) {
    final var builder =
        HttpRequest.newBuilder(uri)
            .header("Authorization", "Bearer " + tokenSupplier.get())
            .header("Accept", "application/json");
    ctx.remaining().filter(d -> !d.isZero()).ifPresent(builder::timeout);
    return builder;
  }

  private <T> T send(final RefreshContext ctx, final HttpRequest request, final Class<T> type) {
    logger.log(DEBUG, "{0} {1}", request.method(), request.uri());
    final HttpResponse<String> response;
    try {
      response = ctx.await(httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString()));
    } catch (final ExecutionException e) {
      throw new AdminApiException(request.method() + " " + request.uri() + " failed", e.getCause());
    }

    if (response.statusCode() / 100 != 2)
      throw new AdminApiException(response.statusCode(), response.body());

    try {
      return mapper.readValue(response.body(), type);
    } catch (final IOException e) {
      throw new AdminApiException("unreadable response from " + request.uri(), e);
    }
  }

  private static String defaultEndpoint() {
    return Optional.ofNullable(System.getProperty("alloydb.admin.endpoint"))
        .or(() -> Optional.ofNullable(System.getenv("ALLOYDB_ADMIN_ENDPOINT")))
        .filter(val -> !val.isBlank())
        .map(String::trim)
        .orElse(DEFAULT_ENDPOINT);
  }

  private static String stripTrailingSlash(final String s) {
    return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
  }

  record GenerateClientCertificateRequest(String pemCsr, String certDuration) {}
}
