package io.github.wphillipmoore.nd.api.gui.exception;

/**
 * Thrown when the response handler is given a non-conforming response or verb, or is committed
 * before both were set. Signals a caller contract violation, not a controller problem.
 */
public final class NdResponseHandlerException extends NdRestException {

  private static final long serialVersionUID = 1L;

  /** Creates a response handler exception. */
  public NdResponseHandlerException(String message) {
    super(message);
  }
}
