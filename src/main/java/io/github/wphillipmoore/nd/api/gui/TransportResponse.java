package io.github.wphillipmoore.nd.api.gui;

import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Immutable response from a transport operation, before any JSON parsing.
 *
 * <p>Headers are defensively copied to guarantee unmodifiability.
 *
 * @param statusCode the HTTP status code
 * @param reasonPhrase the HTTP reason phrase (e.g. {@code "OK"}), never null
 * @param body the response body text, never null (empty string if no body)
 * @param headers the response headers, never null, unmodifiable
 */
public record TransportResponse(
    int statusCode, String reasonPhrase, String body, Map<String, String> headers) {

  /** Validates non-null fields and defensively copies headers. */
  public TransportResponse {
    Objects.requireNonNull(reasonPhrase, "reasonPhrase");
    Objects.requireNonNull(body, "body");
    headers = Map.copyOf(Objects.requireNonNull(headers, "headers"));
  }

  /**
   * Returns the first header whose name matches case-insensitively, or {@code null}.
   *
   * @param name the header name
   * @return the header value, or {@code null}
   */
  public @Nullable String header(String name) {
    for (Map.Entry<String, String> entry : headers.entrySet()) {
      if (name.equalsIgnoreCase(entry.getKey())) {
        return entry.getValue();
      }
    }
    return null;
  }
}
