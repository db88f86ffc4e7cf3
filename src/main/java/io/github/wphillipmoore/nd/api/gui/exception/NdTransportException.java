package io.github.wphillipmoore.nd.api.gui.exception;

import java.util.Objects;

/** Thrown when the controller cannot be reached (connection refused, DNS failure, timeout). */
public final class NdTransportException extends NdRestException {

  private static final long serialVersionUID = 1L;

  private final String url;

  /**
   * Creates a transport exception.
   *
   * @param message description of the failure
   * @param url the URL that was being accessed
   */
  public NdTransportException(String message, String url) {
    super(message);
    this.url = Objects.requireNonNull(url, "url");
  }

  /**
   * Creates a transport exception with a cause.
   *
   * @param message description of the failure
   * @param url the URL that was being accessed
   * @param cause the underlying cause
   */
  public NdTransportException(String message, String url, Throwable cause) {
    super(message, cause);
    this.url = Objects.requireNonNull(url, "url");
  }

  /** Returns the URL that was being accessed when the failure occurred. */
  public String getUrl() {
    return url;
  }
}
