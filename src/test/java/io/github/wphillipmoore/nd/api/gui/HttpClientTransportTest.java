package io.github.wphillipmoore.nd.api.gui;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.sun.net.httpserver.HttpServer;
import com.sun.net.httpserver.HttpsConfigurator;
import com.sun.net.httpserver.HttpsServer;
import io.github.wphillipmoore.nd.api.gui.exception.NdTransportException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class HttpClientTransportTest {

  /** Self-signed certificate for {@code CN=controller.example}, no subject alternative names. */
  private static final String CONTROLLER_KEYSTORE = "/tls/controller.p12";

  private static final char[] KEYSTORE_PASSWORD = "changeit".toCharArray();

  private HttpServer server;
  private String baseUrl;

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress(0), 0);
    int port = server.getAddress().getPort();
    baseUrl = "http://localhost:" + port;
  }

  @AfterEach
  void tearDown() {
    if (server != null) {
      server.stop(0);
    }
  }

  private void startServer(int statusCode, String responseBody) {
    startServer(statusCode, responseBody, Map.of());
  }

  private void startServer(
      int statusCode, String responseBody, Map<String, String> responseHeaders) {
    server.createContext(
        "/",
        exchange -> {
          responseHeaders.forEach((k, v) -> exchange.getResponseHeaders().add(k, v));
          byte[] body = responseBody.getBytes(StandardCharsets.UTF_8);
          exchange.sendResponseHeaders(statusCode, body.length == 0 ? -1 : body.length);
          try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
          }
        });
    server.start();
  }

  @Nested
  class Requests {

    @Test
    void sendsVerbBodyAndHeaders() {
      final String[] captured = new String[4];
      server.createContext(
          "/",
          exchange -> {
            captured[0] = exchange.getRequestMethod();
            captured[1] = exchange.getRequestHeaders().getFirst("Content-type");
            captured[2] = exchange.getRequestHeaders().getFirst("Authorization");
            captured[3] = new String(exchange.getRequestBody().readAllBytes());
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
          });
      server.start();

      HttpClientTransport transport = new HttpClientTransport();
      transport.send(
          HttpVerb.PUT,
          baseUrl + "/fabrics/f1",
          "{\"FABRIC_NAME\":\"f1\"}",
          Map.of("Content-Type", "application/json", "Authorization", "abc123"),
          null,
          true);

      assertThat(captured[0]).isEqualTo("PUT");
      assertThat(captured[1]).isEqualTo("application/json");
      assertThat(captured[2]).isEqualTo("abc123");
      assertThat(captured[3]).isEqualTo("{\"FABRIC_NAME\":\"f1\"}");
    }

    @Test
    void sendsEmptyBodyWithoutPayload() {
      final String[] captured = new String[2];
      server.createContext(
          "/",
          exchange -> {
            captured[0] = exchange.getRequestMethod();
            captured[1] = new String(exchange.getRequestBody().readAllBytes());
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
          });
      server.start();

      new HttpClientTransport()
          .send(HttpVerb.DELETE, baseUrl + "/x", null, Map.of(), Duration.ofSeconds(5), true);

      assertThat(captured[0]).isEqualTo("DELETE");
      assertThat(captured[1]).isEmpty();
    }

    @Test
    void returnsStatusReasonBodyAndHeaders() {
      startServer(404, "{\"error\":\"missing\"}", Map.of("Set-Cookie", "AuthCookie=t1; Path=/"));

      TransportResponse response =
          new HttpClientTransport()
              .send(HttpVerb.GET, baseUrl + "/x", null, Map.of(), null, true);

      assertThat(response.statusCode()).isEqualTo(404);
      assertThat(response.reasonPhrase()).isEqualTo("Not Found");
      assertThat(response.body()).isEqualTo("{\"error\":\"missing\"}");
      assertThat(response.header("Set-Cookie")).isEqualTo("AuthCookie=t1; Path=/");
    }

    @Test
    void returnsEmptyBodyWhenServerSendsNone() {
      startServer(200, "");

      TransportResponse response =
          new HttpClientTransport()
              .send(HttpVerb.GET, baseUrl + "/x", null, Map.of(), null, false);

      assertThat(response.statusCode()).isEqualTo(200);
      assertThat(response.body()).isEmpty();
    }

    @Test
    void nonVerifyingClientIsReused() {
      startServer(200, "{}");

      HttpClientTransport transport = new HttpClientTransport();
      TransportResponse first =
          transport.send(HttpVerb.GET, baseUrl + "/x", null, Map.of(), null, false);
      TransportResponse second =
          transport.send(HttpVerb.GET, baseUrl + "/x", null, Map.of(), null, false);

      assertThat(first.statusCode()).isEqualTo(200);
      assertThat(second.statusCode()).isEqualTo(200);
    }
  }

  @Nested
  class ExceptionHandling {

    @Test
    void rejectsMalformedUrl() {
      assertThatThrownBy(
              () ->
                  new HttpClientTransport()
                      .send(HttpVerb.GET, "https://bad host/x", null, Map.of(), null, true))
          .isInstanceOf(NdTransportException.class)
          .hasMessageContaining("Invalid controller URL");
    }

    @SuppressWarnings("unchecked")
    @Test
    void wrapsTimeout() throws IOException, InterruptedException {
      HttpClient mockClient = mock(HttpClient.class);
      when(mockClient.send(any(), any(HttpResponse.BodyHandler.class)))
          .thenThrow(new HttpTimeoutException("request timed out"));

      HttpClientTransport transport = new HttpClientTransport(mockClient);

      assertThatThrownBy(
              () ->
                  transport.send(
                      HttpVerb.GET,
                      "http://localhost/x",
                      null,
                      Map.of(),
                      Duration.ofSeconds(1),
                      true))
          .isInstanceOf(NdTransportException.class)
          .hasMessageContaining("timed out")
          .hasCauseInstanceOf(HttpTimeoutException.class);
    }

    @SuppressWarnings("unchecked")
    @Test
    void wrapsIoException() throws IOException, InterruptedException {
      HttpClient mockClient = mock(HttpClient.class);
      when(mockClient.send(any(), any(HttpResponse.BodyHandler.class)))
          .thenThrow(new IOException("connection reset"));

      HttpClientTransport transport = new HttpClientTransport(mockClient);

      NdTransportException thrown =
          catchThrowableOfType(
              () -> transport.send(HttpVerb.GET, "http://localhost/x", null, Map.of(), null, true),
              NdTransportException.class);

      assertThat(thrown)
          .hasMessageContaining("Error connecting to the controller")
          .hasCauseInstanceOf(IOException.class);
      assertThat(thrown.getUrl()).isEqualTo("http://localhost/x");
    }

    @SuppressWarnings("unchecked")
    @Test
    void wrapsInterruptedExceptionAndResetsFlag() throws IOException, InterruptedException {
      HttpClient mockClient = mock(HttpClient.class);
      when(mockClient.send(any(), any(HttpResponse.BodyHandler.class)))
          .thenThrow(new InterruptedException("interrupted"));

      HttpClientTransport transport = new HttpClientTransport(mockClient);

      assertThatThrownBy(
              () -> transport.send(HttpVerb.GET, "http://localhost/x", null, Map.of(), null, true))
          .isInstanceOf(NdTransportException.class)
          .hasMessageContaining("HTTP request interrupted")
          .hasCauseInstanceOf(InterruptedException.class);

      assertThat(Thread.currentThread().isInterrupted()).isTrue();
      // Clear the interrupt flag for test cleanup
      Thread.interrupted();
    }

    @Test
    void connectionRefusedWrappedInTransportException() {
      HttpClientTransport transport = new HttpClientTransport();

      assertThatThrownBy(
              () ->
                  transport.send(
                      HttpVerb.GET, "http://localhost:1/unreachable", null, Map.of(), null, true))
          .isInstanceOf(NdTransportException.class)
          .hasCauseInstanceOf(IOException.class);
    }
  }

  @Nested
  class SelfSignedController {

    private HttpsServer httpsServer;
    private String loginUrl;

    @BeforeEach
    void startHttpsServer() throws IOException, GeneralSecurityException {
      httpsServer = HttpsServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
      httpsServer.setHttpsConfigurator(new HttpsConfigurator(controllerSslContext()));
      httpsServer.createContext(
          "/",
          exchange -> {
            byte[] body = "{\"jwttoken\":\"abc123\"}".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
              os.write(body);
            }
          });
      httpsServer.start();
      loginUrl = "https://127.0.0.1:" + httpsServer.getAddress().getPort() + "/login";
    }

    @AfterEach
    void stopHttpsServer() {
      httpsServer.stop(0);
    }

    private SSLContext controllerSslContext() throws IOException, GeneralSecurityException {
      KeyStore keyStore = KeyStore.getInstance("PKCS12");
      try (InputStream in =
          HttpClientTransportTest.class.getResourceAsStream(CONTROLLER_KEYSTORE)) {
        keyStore.load(in, KEYSTORE_PASSWORD);
      }
      KeyManagerFactory keyManagers =
          KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
      keyManagers.init(keyStore, KEYSTORE_PASSWORD);
      SSLContext context = SSLContext.getInstance("TLS");
      context.init(keyManagers.getKeyManagers(), null, null);
      return context;
    }

    @Test
    void reachesControllerByIpWhenVerificationIsDisabled() {
      TransportResponse response =
          new HttpClientTransport()
              .send(HttpVerb.GET, loginUrl, null, Map.of(), Duration.ofSeconds(5), false);

      assertThat(response.statusCode()).isEqualTo(200);
      assertThat(response.body()).isEqualTo("{\"jwttoken\":\"abc123\"}");
    }

    @Test
    void rejectsUntrustedCertificateWhenVerificationIsEnabled() {
      assertThatThrownBy(
              () ->
                  new HttpClientTransport()
                      .send(HttpVerb.GET, loginUrl, null, Map.of(), Duration.ofSeconds(5), true))
          .isInstanceOf(NdTransportException.class)
          .hasMessageContaining("Error connecting to the controller")
          .hasCauseInstanceOf(IOException.class);
    }
  }

  @Nested
  class ReasonPhraseTest {

    @Test
    void knownCodes() {
      assertThat(HttpClientTransport.reasonPhrase(200)).isEqualTo("OK");
      assertThat(HttpClientTransport.reasonPhrase(404)).isEqualTo("Not Found");
      assertThat(HttpClientTransport.reasonPhrase(500)).isEqualTo("Internal Server Error");
    }

    @Test
    void unknownCodeFallsBackToNumber() {
      assertThat(HttpClientTransport.reasonPhrase(599)).isEqualTo("HTTP 599");
    }
  }

  @Nested
  class FlattenHeadersTest {

    @Test
    void joinsMultiValueHeadersWithCommaSpace() {
      Map<String, List<String>> map = new LinkedHashMap<>();
      map.put("Set-Cookie", List.of("lang=en", "AuthCookie=t1"));
      HttpHeaders headers = HttpHeaders.of(map, (k, v) -> true);

      Map<String, String> result = HttpClientTransport.flattenHeaders(headers);

      assertThat(result).containsEntry("Set-Cookie", "lang=en, AuthCookie=t1");
    }

    @Test
    void handlesEmptyHeaders() {
      HttpHeaders headers = HttpHeaders.of(Map.of(), (k, v) -> true);

      assertThat(HttpClientTransport.flattenHeaders(headers)).isEmpty();
    }
  }

  @Nested
  class CreateSslContextTest {

    @Test
    void succeedsWithTlsProtocol() {
      SSLContext context = HttpClientTransport.createSslContext("TLS");

      assertThat(context.getProtocol()).isEqualTo("TLS");
    }

    @Test
    void throwsIllegalStateExceptionForInvalidProtocol() {
      assertThatThrownBy(() -> HttpClientTransport.createSslContext("INVALID"))
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("Failed to create SSLContext");
    }

    @Test
    void trustAllManagerAcceptsAnything() {
      HttpClientTransport.TrustAllManager manager = new HttpClientTransport.TrustAllManager();

      manager.checkServerTrusted(null, null);
      manager.checkClientTrusted(null, null);
      manager.checkServerTrusted(null, null, (SSLEngine) null);
      manager.checkClientTrusted(null, null, (SSLEngine) null);
      manager.checkServerTrusted(null, null, (Socket) null);
      manager.checkClientTrusted(null, null, (Socket) null);

      assertThat(manager.getAcceptedIssuers()).isEmpty();
    }
  }
}
