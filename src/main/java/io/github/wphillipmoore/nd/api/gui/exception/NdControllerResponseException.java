package io.github.wphillipmoore.nd.api.gui.exception;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when the controller answers a query with a status the caller cannot use.
 *
 * <p>The {@code data} is the parsed response body, or {@code null} if it was not available.
 */
public final class NdControllerResponseException extends NdRestException {

  private static final long serialVersionUID = 1L;

  private final int statusCode;
  private final @Nullable String controllerMessage;
  private final transient @Nullable Object data;

  /**
   * Creates a controller response exception.
   *
   * @param message description of the failure
   * @param statusCode the HTTP status code returned by the controller
   * @param controllerMessage the controller's reason phrase, or {@code null}
   * @param data the parsed response body, or {@code null}
   */
  public NdControllerResponseException(
      String message, int statusCode, @Nullable String controllerMessage, @Nullable Object data) {
    super(message);
    this.statusCode = statusCode;
    this.controllerMessage = controllerMessage;
    this.data = data;
  }

  /**
   * Creates a controller response exception with a cause.
   *
   * @param message description of the failure
   * @param statusCode the HTTP status code returned by the controller
   * @param controllerMessage the controller's reason phrase, or {@code null}
   * @param data the parsed response body, or {@code null}
   * @param cause the underlying cause
   */
  public NdControllerResponseException(
      String message,
      int statusCode,
      @Nullable String controllerMessage,
      @Nullable Object data,
      Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
    this.controllerMessage = controllerMessage;
    this.data = data;
  }

  /** Returns the HTTP status code returned by the controller. */
  public int getStatusCode() {
    return statusCode;
  }

  /** Returns the controller's reason phrase, or {@code null}. */
  public @Nullable String getControllerMessage() {
    return controllerMessage;
  }

  /** Returns the parsed response body, or {@code null}. */
  public @Nullable Object getData() {
    return data;
  }
}
