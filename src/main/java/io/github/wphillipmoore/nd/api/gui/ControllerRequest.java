package io.github.wphillipmoore.nd.api.gui;

import io.github.wphillipmoore.nd.api.gui.exception.NdConfigurationException;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A single pending request to the controller.
 *
 * <p>Built fresh for every call and never retained by the session after the call completes. The
 * payload is defensively copied as unmodifiable. Required fields are checked by {@link
 * ControllerSession#send(ControllerRequest)} so that a missing verb or path fails before any
 * network activity.
 *
 * @param verb the HTTP method, or {@code null} if not yet chosen
 * @param path the endpoint path, absolute or relative, or {@code null} if not yet chosen
 * @param payload JSON-serializable request body, or {@code null} for no body
 * @param timeout per-call timeout overriding the session default, or {@code null}
 */
public record ControllerRequest(
    @Nullable HttpVerb verb,
    @Nullable String path,
    @Nullable Map<String, Object> payload,
    @Nullable Duration timeout) {

  /** Defensively copies the payload. */
  public ControllerRequest {
    payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : null;
  }

  /** Creates a GET request. */
  public static ControllerRequest get(String path) {
    return new ControllerRequest(HttpVerb.GET, path, null, null);
  }

  /** Creates a POST request with a JSON body. */
  public static ControllerRequest post(String path, @Nullable Map<String, Object> payload) {
    return new ControllerRequest(HttpVerb.POST, path, payload, null);
  }

  /** Creates a PUT request with a JSON body. */
  public static ControllerRequest put(String path, @Nullable Map<String, Object> payload) {
    return new ControllerRequest(HttpVerb.PUT, path, payload, null);
  }

  /** Creates a DELETE request. */
  public static ControllerRequest delete(String path) {
    return new ControllerRequest(HttpVerb.DELETE, path, null, null);
  }

  /**
   * Creates a request from a verb name.
   *
   * @param verb one of GET, POST, PUT, DELETE
   * @param path the endpoint path
   * @param payload JSON-serializable request body, or {@code null}
   * @return the request
   * @throws NdConfigurationException if the verb is not recognized
   */
  public static ControllerRequest of(
      String verb, String path, @Nullable Map<String, Object> payload) {
    HttpVerb parsed = HttpVerb.find(verb);
    if (parsed == null) {
      throw new NdConfigurationException(
          "verb must be one of DELETE, GET, POST, PUT. Got " + verb + ".");
    }
    return new ControllerRequest(parsed, path, payload, null);
  }

  /** Returns a copy of this request with a per-call timeout. */
  public ControllerRequest withTimeout(@Nullable Duration timeout) {
    return new ControllerRequest(verb, path, payload, timeout);
  }
}
