package io.github.wphillipmoore.nd.api.gui.exception;

/**
 * Thrown when a required setting is missing or invalid.
 *
 * <p>Always raised before any network activity. Callers recover by correcting the configuration
 * (host, path, verb, credentials or timeout) and calling again.
 */
public final class NdConfigurationException extends NdRestException {

  private static final long serialVersionUID = 1L;

  /** Creates a configuration exception. */
  public NdConfigurationException(String message) {
    super(message);
  }

  /** Creates a configuration exception with a cause. */
  public NdConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
