package io.github.wphillipmoore.nd.api.gui.exception;

/**
 * Base exception for all Nexus Dashboard REST client errors.
 *
 * <p>This is an unchecked exception hierarchy. Every failure raised by the session, the response
 * handler and the template layer extends this sealed class.
 */
public sealed class NdRestException extends RuntimeException
    permits NdConfigurationException,
        NdTransportException,
        NdAuthException,
        NdResponseHandlerException,
        NdControllerResponseException {

  private static final long serialVersionUID = 1L;

  /** Creates an exception with the given message. */
  public NdRestException(String message) {
    super(message);
  }

  /** Creates an exception with the given message and cause. */
  public NdRestException(String message, Throwable cause) {
    super(message, cause);
  }
}
