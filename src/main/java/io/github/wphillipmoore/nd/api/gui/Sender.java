package io.github.wphillipmoore.nd.api.gui;

/**
 * Sends requests to the controller and returns raw responses.
 *
 * <p>{@link RestSend} depends on this seam rather than on {@link ControllerSession} directly, so
 * orchestration can be exercised against a canned sender.
 */
public interface Sender {

  /**
   * Sends one request and returns the raw response.
   *
   * @param request the request
   * @return the raw response, whatever its status code
   * @throws io.github.wphillipmoore.nd.api.gui.exception.NdConfigurationException if a required
   *     setting is missing
   * @throws io.github.wphillipmoore.nd.api.gui.exception.NdTransportException if the controller
   *     cannot be reached
   */
  ControllerResponse send(ControllerRequest request);

  /** Authenticates if not already authenticated. */
  void login();

  /** Re-authenticates unconditionally, replacing the current token. */
  void refreshLogin();
}
