package io.github.wphillipmoore.nd.api.gui;

import java.time.Duration;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Transport interface for controller HTTP communication.
 *
 * <p>Implementations perform exactly one HTTP exchange per call and should throw {@link
 * io.github.wphillipmoore.nd.api.gui.exception.NdTransportException} for network or connection
 * failures. They never retry.
 */
public interface NdRestTransport {

  /**
   * Sends a request to the controller.
   *
   * @param verb the HTTP method
   * @param url fully-qualified URL to send the request to
   * @param jsonBody serialized JSON request body, or {@code null} for no body
   * @param headers HTTP headers to include in the request
   * @param timeout request timeout, or {@code null} for no timeout
   * @param verifyTls whether to verify TLS certificates
   * @return the transport response
   */
  TransportResponse send(
      HttpVerb verb,
      String url,
      @Nullable String jsonBody,
      Map<String, String> headers,
      @Nullable Duration timeout,
      boolean verifyTls);
}
