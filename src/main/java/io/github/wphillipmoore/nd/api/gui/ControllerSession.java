package io.github.wphillipmoore.nd.api.gui;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import io.github.wphillipmoore.nd.api.gui.auth.ControllerCredentials;
import io.github.wphillipmoore.nd.api.gui.diagnostics.DiagnosticSink;
import io.github.wphillipmoore.nd.api.gui.diagnostics.Slf4jDiagnosticSink;
import io.github.wphillipmoore.nd.api.gui.exception.NdAuthException;
import io.github.wphillipmoore.nd.api.gui.exception.NdConfigurationException;
import io.github.wphillipmoore.nd.api.gui.exception.NdTransportException;
import java.io.IOException;
import java.io.StringReader;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Authenticated session against a Nexus Dashboard controller.
 *
 * <p>Owns the network transport, the credentials, the current token and a bounded call history.
 * Every call is synchronous and performs exactly one HTTP exchange; nothing is retried. Instances
 * are not thread-safe: token renewal and history updates are unguarded, so concurrent callers must
 * serialize access or use one session each.
 *
 * <p>{@link #send(ControllerRequest)} does not require a prior {@link #login()}. A request sent
 * without a token simply receives the controller's authorization failure as a normal response.
 *
 * <pre>{@code
 * ControllerSession session = new ControllerSession.Builder(
 *         ControllerCredentials.fromEnvironment(System.getenv()))
 *     .timeoutSeconds(30)
 *     .build();
 * session.login();
 * ControllerResponse response = session.send(ControllerRequest.get("/appcenter/..."));
 * }</pre>
 */
public final class ControllerSession implements Sender {

  static final String SCHEME = "https://";
  static final String LOGIN_PATH = "/login";
  static final String REFRESH_PATH = "/refresh";
  static final String SESSION_COOKIE = "AuthCookie";
  static final String PASSWORD_FIELD = "userPasswd";
  static final String PASSWORD_MASK = "********";
  static final List<String> TOKEN_FIELDS = List.of("jwttoken", "token");
  static final String RBAC_FIELD = "rbac";

  private static final Gson GSON = new Gson();
  private static final TypeAdapter<Object> JSON_ADAPTER = GSON.getAdapter(Object.class);
  private static final int DEFAULT_TIMEOUT_SECONDS = 30;

  private final ControllerCredentials credentials;
  private final NdRestTransport transport;
  private final Duration timeout;
  private final boolean verifyTls;
  private final DiagnosticSink diagnostics;
  private final RequestHistory history = new RequestHistory();

  private boolean authenticated;
  private String token = "";
  private Map<String, Object> rbac = Map.of();
  private int lastStatusCode = -1;
  private String lastUrl = "";

  private ControllerSession(Builder builder) {
    this.credentials = builder.credentials;
    this.transport = builder.transport != null ? builder.transport : new HttpClientTransport();
    this.timeout = Duration.ofSeconds(builder.timeoutSeconds);
    this.verifyTls = builder.verifyTls;
    this.diagnostics =
        builder.diagnostics != null
            ? builder.diagnostics
            : Slf4jDiagnosticSink.forClass(ControllerSession.class);
  }

  /**
   * Logs in to the controller and stores the issued token.
   *
   * <p>Returns immediately, without a network call, if the session is already authenticated.
   *
   * @throws NdConfigurationException if username, password, domain or host is not set
   * @throws NdTransportException if the controller cannot be reached
   * @throws NdAuthException if the response does not contain a token
   */
  @Override
  public void login() {
    if (authenticated) {
      return;
    }
    authenticate(LOGIN_PATH, "login()");
  }

  /**
   * Re-authenticates with the existing credentials, replacing the current token.
   *
   * <p>Does not consult the authenticated flag; intended for forcing a new token after the
   * controller expired the old one.
   *
   * @throws NdConfigurationException if username, password, domain or host is not set
   * @throws NdTransportException if the controller cannot be reached
   * @throws NdAuthException if the response does not contain a token
   */
  @Override
  public void refreshLogin() {
    authenticate(REFRESH_PATH, "refreshLogin()");
  }

  private void authenticate(String path, String operation) {
    verifyCredentials(operation);

    String previousToken = token;
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("userName", credentials.username());
    payload.put(PASSWORD_FIELD, credentials.password());
    payload.put("domain", credentials.domain());

    ControllerResponse response = send(ControllerRequest.post(path, payload));

    String issued = extractToken(response.data());
    if (issued == null) {
      token = previousToken;
      String message =
          "Unable to parse token from "
              + operation
              + " response. RETURN_CODE: "
              + response.statusCode()
              + ", MESSAGE: "
              + response.message()
              + ".";
      diagnostics.error(message);
      throw new NdAuthException(message, lastUrl, response.statusCode());
    }
    token = issued;
    rbac = extractRbac(response.data());
    authenticated = true;
    diagnostics.debug(operation + ": authenticated as " + credentials.username());
  }

  private void verifyCredentials(String operation) {
    if (credentials.username().isBlank()) {
      throw configurationError("username must be set before calling " + operation);
    }
    if (credentials.password().isBlank()) {
      throw configurationError("password must be set before calling " + operation);
    }
    if (credentials.domain().isBlank()) {
      throw configurationError("domain must be set before calling " + operation);
    }
  }

  /**
   * Sends a request and returns the raw response.
   *
   * <p>The session token, if any, is attached as the {@code Authorization} header and the {@code
   * AuthCookie} cookie. If the controller issues a new session cookie to an authenticated session,
   * the token is replaced before this method returns. The status code and path are recorded in the
   * history.
   *
   * @param request the request
   * @return the raw response, whatever its status code
   * @throws NdConfigurationException if host, path or verb is not set
   * @throws NdTransportException if the controller cannot be reached
   */
  @Override
  public ControllerResponse send(ControllerRequest request) {
    Objects.requireNonNull(request, "request");
    HttpVerb verb = request.verb();
    String path = request.path();
    if (credentials.host().isEmpty()) {
      throw configurationError("ip4 or ip6 must be set before calling send()");
    }
    if (path == null || path.isBlank()) {
      throw configurationError("path must be set before calling send()");
    }
    if (verb == null) {
      throw configurationError("verb must be set before calling send()");
    }

    String normalizedPath = normalizePath(path);
    String url = SCHEME + credentials.urlHost() + normalizedPath;
    String jsonBody = request.payload() != null ? GSON.toJson(request.payload()) : null;
    Duration effectiveTimeout = request.timeout() != null ? request.timeout() : timeout;

    StringBuilder message = new StringBuilder(128);
    message.append("Calling controller: verb ").append(verb).append(", url ").append(url);
    if (request.payload() != null) {
      message.append(", payload ").append(GSON.toJson(maskPassword(request.payload())));
    }
    diagnostics.debug(message.toString());

    TransportResponse transportResponse;
    try {
      transportResponse =
          transport.send(verb, url, jsonBody, buildHeaders(), effectiveTimeout, verifyTls);
    } catch (NdTransportException e) {
      diagnostics.error("Error connecting to the controller at " + url + ": " + e.getMessage());
      throw e;
    }

    // Cookies set before the first successful login (load balancer affinity, a 401) are not tokens.
    String renewed = extractSessionCookie(transportResponse.header("Set-Cookie"));
    if (renewed != null && authenticated) {
      token = renewed;
      diagnostics.debug("Controller issued a new session cookie");
    }

    lastStatusCode = transportResponse.statusCode();
    lastUrl = url;
    history.add(transportResponse.statusCode(), normalizedPath);

    ControllerResponse response =
        ControllerResponse.of(
            transportResponse.statusCode(),
            transportResponse.reasonPhrase(),
            parseResponseData(transportResponse.body()),
            verb.name(),
            normalizedPath);
    diagnostics.debug(
        "Controller response: RETURN_CODE "
            + response.statusCode()
            + ", MESSAGE "
            + response.message());
    return response;
  }

  private Map<String, String> buildHeaders() {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("Content-Type", "application/json");
    if (!token.isEmpty()) {
      headers.put("Cookie", SESSION_COOKIE + "=" + token);
      headers.put(SESSION_COOKIE, token);
      headers.put("Authorization", token);
    }
    return headers;
  }

  private NdConfigurationException configurationError(String message) {
    diagnostics.debug(message);
    return new NdConfigurationException(message);
  }

  /** Writes the call history to the diagnostic sink, most recent call first. */
  public void logHistory() {
    diagnostics.debug(
        "History (last "
            + history.capacity()
            + " calls, most recent on top)\n"
            + String.format("%-11s %-70s%n", "RESULT_CODE", "Path")
            + String.format("%-11s %-70s", "-".repeat(11), "-".repeat(70)));
    for (RequestHistory.Entry entry : history.entries()) {
      diagnostics.debug(String.format("%-11d %-70s", entry.statusCode(), entry.path()));
    }
  }

  /** Returns {@code true} once a login or refresh round-trip has succeeded. */
  public boolean isAuthenticated() {
    return authenticated;
  }

  /** Returns the current token, or an empty string before the first token was issued. */
  public String getToken() {
    return token;
  }

  /** Returns the RBAC object from the last successful login. The map is unmodifiable. */
  public Map<String, Object> getRbac() {
    return rbac;
  }

  /** Returns the status code of the last call, or {@code -1} before any call. */
  public int getLastStatusCode() {
    return lastStatusCode;
  }

  /** Returns the URL of the last call, or an empty string before any call. */
  public String getLastUrl() {
    return lastUrl;
  }

  /** Returns a snapshot of the call history, most recent first. */
  public List<RequestHistory.Entry> getHistory() {
    return history.entries();
  }

  /** Returns the credentials this session authenticates with. */
  public ControllerCredentials getCredentials() {
    return credentials;
  }

  /** Returns the default per-call timeout. */
  public Duration getTimeout() {
    return timeout;
  }

  static String normalizePath(String path) {
    String trimmed = path.strip();
    int start = 0;
    while (start < trimmed.length() && trimmed.charAt(start) == '/') {
      start++;
    }
    return "/" + trimmed.substring(start);
  }

  static Map<String, Object> maskPassword(Map<String, Object> payload) {
    Map<String, Object> masked = new LinkedHashMap<>(payload);
    if (masked.containsKey(PASSWORD_FIELD)) {
      masked.put(PASSWORD_FIELD, PASSWORD_MASK);
    }
    return masked;
  }

  /**
   * Extracts the session token from a {@code Set-Cookie} header value.
   *
   * <p>Prefers the {@code AuthCookie} cookie; otherwise falls back to the value of the first
   * cookie in the header.
   *
   * @param setCookie the header value, or {@code null}
   * @return the token, or {@code null} if the header carries no cookie value
   */
  static @Nullable String extractSessionCookie(@Nullable String setCookie) {
    if (setCookie == null || setCookie.isBlank()) {
      return null;
    }
    for (String part : setCookie.split("[;,]")) {
      String trimmed = part.trim();
      if (trimmed.startsWith(SESSION_COOKIE + "=")) {
        String value = trimmed.substring(SESSION_COOKIE.length() + 1);
        return value.isEmpty() ? null : value;
      }
    }
    String first = setCookie.split(";", 2)[0].trim();
    int eqIndex = first.indexOf('=');
    if (eqIndex <= 0 || eqIndex == first.length() - 1) {
      return null;
    }
    return first.substring(eqIndex + 1);
  }

  static @Nullable String extractToken(Object data) {
    if (!(data instanceof Map<?, ?> map)) {
      return null;
    }
    for (String field : TOKEN_FIELDS) {
      if (map.get(field) instanceof String value && !value.isBlank()) {
        return value;
      }
    }
    return null;
  }

  @SuppressWarnings("unchecked")
  static Map<String, Object> extractRbac(Object data) {
    if (data instanceof Map<?, ?> map && map.get(RBAC_FIELD) instanceof Map<?, ?> value) {
      return Collections.unmodifiableMap(new LinkedHashMap<>((Map<String, Object>) value));
    }
    return Map.of();
  }

  /**
   * Parses a response body as strict JSON.
   *
   * @param text the body text
   * @return the decoded value; a JSON {@code null} or empty object yields an empty map, and text
   *     that is not JSON yields {@code {"INVALID_JSON": text}}
   */
  static Object parseResponseData(String text) {
    if (text.isBlank()) {
      return invalidJson(text);
    }
    try {
      JsonReader reader = new JsonReader(new StringReader(text));
      reader.setLenient(false);
      Object decoded = JSON_ADAPTER.read(reader);
      if (reader.peek() != JsonToken.END_DOCUMENT) {
        return invalidJson(text);
      }
      return decoded != null ? decoded : new LinkedHashMap<String, Object>();
    } catch (IOException | IllegalStateException | JsonParseException e) {
      return invalidJson(text);
    }
  }

  private static Map<String, Object> invalidJson(String text) {
    Map<String, Object> wrapped = new LinkedHashMap<>();
    wrapped.put(ControllerResponse.INVALID_JSON, text);
    return wrapped;
  }

  /** Builder for {@link ControllerSession}. */
  public static final class Builder {

    private final ControllerCredentials credentials;
    private @Nullable NdRestTransport transport;
    private int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
    private boolean verifyTls;
    private @Nullable DiagnosticSink diagnostics;

    /**
     * Creates a builder for the given credentials.
     *
     * @param credentials controller address and login credentials
     */
    public Builder(ControllerCredentials credentials) {
      this.credentials = Objects.requireNonNull(credentials, "credentials");
    }

    /** Sets the transport. Defaults to a new {@link HttpClientTransport}. */
    public Builder transport(NdRestTransport transport) {
      this.transport = Objects.requireNonNull(transport, "transport");
      return this;
    }

    /**
     * Sets the default per-call timeout. Defaults to 30 seconds.
     *
     * @param timeoutSeconds timeout in seconds
     * @throws NdConfigurationException if the timeout is not positive
     */
    public Builder timeoutSeconds(int timeoutSeconds) {
      if (timeoutSeconds <= 0) {
        throw new NdConfigurationException(
            "timeout must be a positive integer. Got " + timeoutSeconds + ".");
      }
      this.timeoutSeconds = timeoutSeconds;
      return this;
    }

    /**
     * Sets the default per-call timeout from text, e.g. an environment variable.
     *
     * @param timeoutSeconds timeout in seconds
     * @throws NdConfigurationException if the text is not a positive integer
     */
    public Builder timeoutSeconds(String timeoutSeconds) {
      Objects.requireNonNull(timeoutSeconds, "timeoutSeconds");
      int parsed;
      try {
        parsed = Integer.parseInt(timeoutSeconds.strip());
      } catch (NumberFormatException e) {
        throw new NdConfigurationException(
            "timeout must be an integer. Got " + timeoutSeconds + ".", e);
      }
      return timeoutSeconds(parsed);
    }

    /** Sets whether to verify TLS certificates. Defaults to {@code false}. */
    public Builder verifyTls(boolean verifyTls) {
      this.verifyTls = verifyTls;
      return this;
    }

    /** Sets the diagnostic sink. Defaults to an SLF4J logger named {@code nd.ControllerSession}. */
    public Builder diagnostics(DiagnosticSink diagnostics) {
      this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
      return this;
    }

    /** Builds the session. The session starts unauthenticated. */
    public ControllerSession build() {
      return new ControllerSession(this);
    }
  }
}
