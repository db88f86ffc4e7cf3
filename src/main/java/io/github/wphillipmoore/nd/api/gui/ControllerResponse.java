package io.github.wphillipmoore.nd.api.gui;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Raw controller response as returned by {@link Sender#send(ControllerRequest)}.
 *
 * <p>{@code data} holds the parsed JSON body (object, array or scalar). A body that is not JSON is
 * wrapped as a single-entry map under {@link #INVALID_JSON}. {@code error} carries the body's
 * {@code ERROR} field when the controller embedded one, which some releases do even with a 200
 * status.
 *
 * @param statusCode the HTTP status code
 * @param message the HTTP reason phrase, e.g. {@code "OK"} or {@code "Not Found"}
 * @param data the parsed body, never null
 * @param verb the originating HTTP method
 * @param path the originating request path
 * @param error the embedded error field, or {@code null}
 */
public record ControllerResponse(
    int statusCode,
    String message,
    Object data,
    String verb,
    String path,
    @Nullable Object error) {

  /** Key under which a non-JSON body is wrapped. */
  public static final String INVALID_JSON = "INVALID_JSON";

  /** Name of the embedded error field. */
  public static final String ERROR_FIELD = "ERROR";

  /** Validates non-null fields. */
  public ControllerResponse {
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(data, "data");
    Objects.requireNonNull(verb, "verb");
    Objects.requireNonNull(path, "path");
  }

  /**
   * Creates a response, taking the error field from {@code data} when it is a JSON object.
   *
   * @param statusCode the HTTP status code
   * @param message the HTTP reason phrase
   * @param data the parsed body
   * @param verb the originating HTTP method
   * @param path the originating request path
   * @return the response
   */
  public static ControllerResponse of(
      int statusCode, String message, Object data, String verb, String path) {
    Object error = data instanceof Map<?, ?> map ? map.get(ERROR_FIELD) : null;
    return new ControllerResponse(statusCode, message, data, verb, path, error);
  }

  /** Returns {@code true} if the response carries a non-empty error field. */
  public boolean hasError() {
    if (error == null) {
      return false;
    }
    if (error instanceof String text) {
      return !text.isBlank();
    }
    if (error instanceof Map<?, ?> map) {
      return !map.isEmpty();
    }
    if (error instanceof Collection<?> collection) {
      return !collection.isEmpty();
    }
    return true;
  }

  /** Returns {@code data} as a JSON object, or an empty map if it is not one. */
  @SuppressWarnings("unchecked")
  public Map<String, Object> dataAsMap() {
    if (data instanceof Map) {
      return Collections.unmodifiableMap((Map<String, Object>) data);
    }
    return Map.of();
  }

  /** Returns {@code data} as a JSON array, or an empty list if it is not one. */
  @SuppressWarnings("unchecked")
  public List<Object> dataAsList() {
    if (data instanceof List) {
      return Collections.unmodifiableList((List<Object>) data);
    }
    return List.of();
  }

  /**
   * Renders the response in the controller dictionary form: {@code RETURN_CODE}, {@code MESSAGE},
   * {@code DATA}, {@code METHOD}, {@code REQUEST_PATH} and, when present, {@code ERROR}.
   *
   * @return an unmodifiable map
   */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("RETURN_CODE", statusCode);
    map.put("MESSAGE", message);
    map.put("DATA", data);
    map.put("METHOD", verb);
    map.put("REQUEST_PATH", path);
    if (error != null) {
      map.put(ERROR_FIELD, error);
    }
    return Collections.unmodifiableMap(map);
  }
}
