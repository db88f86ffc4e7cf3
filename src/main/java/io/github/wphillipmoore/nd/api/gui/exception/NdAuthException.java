package io.github.wphillipmoore.nd.api.gui.exception;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when a login or refresh round-trip completes but the controller does not issue a token.
 *
 * <p>Distinct from {@link NdTransportException}: the controller was reached but rejected the
 * credentials or answered with an unexpected payload.
 */
public final class NdAuthException extends NdRestException {

  private static final long serialVersionUID = 1L;

  private final String url;
  private final @Nullable Integer statusCode;

  /**
   * Creates an auth exception.
   *
   * @param message description of the failure
   * @param url the login or refresh URL
   * @param statusCode the HTTP status code, or {@code null} if unavailable
   */
  public NdAuthException(String message, String url, @Nullable Integer statusCode) {
    super(message);
    this.url = Objects.requireNonNull(url, "url");
    this.statusCode = statusCode;
  }

  /** Returns the login or refresh URL. */
  public String getUrl() {
    return url;
  }

  /**
   * Returns the HTTP status code, or {@code null} if the status code was not available.
   *
   * @return the status code, or {@code null}
   */
  public @Nullable Integer getStatusCode() {
    return statusCode;
  }
}
