package io.github.wphillipmoore.nd.api.gui;

import io.github.wphillipmoore.nd.api.gui.exception.NdTransportException;
import java.io.IOException;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.security.GeneralSecurityException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509ExtendedTrustManager;
import org.jspecify.annotations.Nullable;

/**
 * JDK {@link HttpClient}-based implementation of {@link NdRestTransport}.
 *
 * <p>The JDK client does not expose the server's reason phrase, so the standard phrase for the
 * status code is reported instead.
 */
public final class HttpClientTransport implements NdRestTransport {

  private static final Map<Integer, String> REASON_PHRASES =
      Map.ofEntries(
          Map.entry(200, "OK"),
          Map.entry(201, "Created"),
          Map.entry(202, "Accepted"),
          Map.entry(204, "No Content"),
          Map.entry(301, "Moved Permanently"),
          Map.entry(302, "Found"),
          Map.entry(304, "Not Modified"),
          Map.entry(400, "Bad Request"),
          Map.entry(401, "Unauthorized"),
          Map.entry(403, "Forbidden"),
          Map.entry(404, "Not Found"),
          Map.entry(405, "Method Not Allowed"),
          Map.entry(408, "Request Timeout"),
          Map.entry(409, "Conflict"),
          Map.entry(415, "Unsupported Media Type"),
          Map.entry(422, "Unprocessable Entity"),
          Map.entry(429, "Too Many Requests"),
          Map.entry(500, "Internal Server Error"),
          Map.entry(501, "Not Implemented"),
          Map.entry(502, "Bad Gateway"),
          Map.entry(503, "Service Unavailable"),
          Map.entry(504, "Gateway Timeout"));

  private final HttpClient client;
  private @Nullable HttpClient nonVerifyingClient;

  /** Creates a transport with a default TLS-verifying {@link HttpClient}. */
  public HttpClientTransport() {
    this.client = HttpClient.newHttpClient();
  }

  /**
   * Creates a transport with an injected {@link HttpClient}. Package-private for testing.
   *
   * @param client the HTTP client to use
   */
  HttpClientTransport(HttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  @SuppressWarnings("PMD.CloseResource") // HttpClient is managed by this transport, not disposable
  public TransportResponse send(
      HttpVerb verb,
      String url,
      @Nullable String jsonBody,
      Map<String, String> headers,
      @Nullable Duration timeout,
      boolean verifyTls) {
    HttpClient activeClient = verifyTls ? client : getNonVerifyingClient();

    HttpRequest.BodyPublisher publisher =
        jsonBody != null
            ? HttpRequest.BodyPublishers.ofString(jsonBody)
            : HttpRequest.BodyPublishers.noBody();
    HttpRequest.Builder requestBuilder;
    try {
      requestBuilder = HttpRequest.newBuilder().uri(URI.create(url)).method(verb.name(), publisher);
    } catch (IllegalArgumentException e) {
      throw new NdTransportException("Invalid controller URL", url, e);
    }

    headers.forEach(requestBuilder::header);

    if (timeout != null) {
      requestBuilder.timeout(timeout);
    }

    HttpResponse<String> response;
    try {
      response = activeClient.send(requestBuilder.build(), HttpResponse.BodyHandlers.ofString());
    } catch (HttpTimeoutException e) {
      throw new NdTransportException("HTTP request timed out", url, e);
    } catch (IOException e) {
      throw new NdTransportException("Error connecting to the controller", url, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new NdTransportException("HTTP request interrupted", url, e);
    }

    String body = response.body() != null ? response.body() : "";
    return new TransportResponse(
        response.statusCode(),
        reasonPhrase(response.statusCode()),
        body,
        flattenHeaders(response.headers()));
  }

  /**
   * Returns the standard reason phrase for a status code.
   *
   * @param statusCode the HTTP status code
   * @return the reason phrase, or {@code "HTTP <code>"} for codes without a standard phrase
   */
  static String reasonPhrase(int statusCode) {
    String phrase = REASON_PHRASES.get(statusCode);
    return phrase != null ? phrase : "HTTP " + statusCode;
  }

  private synchronized HttpClient getNonVerifyingClient() {
    if (nonVerifyingClient == null) {
      SSLContext sslContext = createSslContext("TLS");
      nonVerifyingClient = HttpClient.newBuilder().sslContext(sslContext).build();
    }
    return nonVerifyingClient;
  }

  /**
   * Creates an {@link SSLContext} with a trust-all manager.
   *
   * @param protocol the SSL protocol name (e.g. "TLS")
   * @return an initialized SSLContext that trusts all certificates
   * @throws IllegalStateException if the protocol is not available
   */
  static SSLContext createSslContext(String protocol) {
    try {
      SSLContext sslContext = SSLContext.getInstance(protocol);
      sslContext.init(null, new TrustManager[] {new TrustAllManager()}, null);
      return sslContext;
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Failed to create SSLContext", e);
    }
  }

  /**
   * Flattens {@link HttpHeaders} multi-value map to a single-value map.
   *
   * <p>Multiple values for the same header name are joined with {@code ", "}.
   *
   * @param httpHeaders the HTTP response headers
   * @return a flattened string-to-string header map
   */
  static Map<String, String> flattenHeaders(HttpHeaders httpHeaders) {
    Map<String, String> result = new LinkedHashMap<>();
    httpHeaders.map().forEach((name, values) -> result.put(name, String.join(", ", values)));
    return result;
  }

  /**
   * Trust manager used when TLS verification is disabled; controllers ship self-signed certs and
   * are usually reached by IP address.
   *
   * <p>Extends {@link X509ExtendedTrustManager} so JSSE calls it directly instead of wrapping it in
   * a checker that still performs endpoint identification. Neither the chain nor the host name is
   * checked.
   */
  static final class TrustAllManager extends X509ExtendedTrustManager {

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) {
      // Accept all client certificates
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {
      // Accept all client certificates
    }

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
      // Accept all client certificates
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) {
      // Accept all server certificates
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {
      // Accept all server certificates, whatever host name they were issued for
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
      // Accept all server certificates, whatever host name they were issued for
    }

    @Override
    public X509Certificate[] getAcceptedIssuers() {
      return new X509Certificate[0];
    }
  }
}
