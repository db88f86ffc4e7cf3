package io.github.wphillipmoore.nd.api.gui.response;

import io.github.wphillipmoore.nd.api.gui.ControllerResponse;
import io.github.wphillipmoore.nd.api.gui.HttpVerb;
import io.github.wphillipmoore.nd.api.gui.diagnostics.DiagnosticSink;
import io.github.wphillipmoore.nd.api.gui.exception.NdResponseHandlerException;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Classifies a raw controller response into a verb-aware {@link ResponseOutcome}.
 *
 * <p>Set {@link #verb(String)} and {@link #response(ControllerResponse)}, call {@link #commit()},
 * then read {@link #getResult()}. The rules are:
 *
 * <ul>
 *   <li>GET: 404 with message {@code "Not Found"} is a successful query for an absent resource.
 *       Any other status outside {200, 404}, or any message other than {@code "OK"}, is a failed
 *       query. Everything else is found.
 *   <li>POST, PUT, DELETE: a non-empty {@code ERROR} field fails the call regardless of status.
 *       A message other than {@code "OK"} fails the call. Everything else changed the controller.
 * </ul>
 *
 * <p>The handler performs no network access and holds no state beyond its inputs and result.
 */
public final class ResponseHandler {

  static final Set<Integer> SUCCESS_STATUS_CODES = Set.of(200, 404);
  static final String MESSAGE_OK = "OK";
  static final String MESSAGE_NOT_FOUND = "Not Found";

  private final DiagnosticSink diagnostics;

  private @Nullable HttpVerb verb;
  private @Nullable ControllerResponse response;
  private @Nullable ResponseOutcome result;

  /** Creates a handler that discards diagnostics. */
  public ResponseHandler() {
    this(DiagnosticSink.noop());
  }

  /**
   * Creates a handler.
   *
   * @param diagnostics sink for classification messages
   */
  public ResponseHandler(DiagnosticSink diagnostics) {
    this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
  }

  /**
   * Classifies a response in one step.
   *
   * @param verb the request verb
   * @param response the raw response
   * @return the outcome
   * @throws NdResponseHandlerException if the response lacks a status code or message
   */
  public static ResponseOutcome classify(HttpVerb verb, ControllerResponse response) {
    return new ResponseHandler().verb(verb).response(response).commit();
  }

  /**
   * Sets the request verb.
   *
   * @param value one of DELETE, GET, POST, PUT
   * @return this handler
   * @throws NdResponseHandlerException if the verb is not valid
   */
  public ResponseHandler verb(@Nullable String value) {
    HttpVerb parsed = HttpVerb.find(value);
    if (parsed == null) {
      throw new NdResponseHandlerException(
          "ResponseHandler.verb must be one of DELETE, GET, POST, PUT. Got " + value + ".");
    }
    return verb(parsed);
  }

  /** Sets the request verb. */
  public ResponseHandler verb(HttpVerb value) {
    this.verb = Objects.requireNonNull(value, "verb");
    this.result = null;
    return this;
  }

  /**
   * Sets the controller response.
   *
   * @param value the raw response
   * @return this handler
   * @throws NdResponseHandlerException if the status code is not positive or the message is blank
   */
  public ResponseHandler response(ControllerResponse value) {
    Objects.requireNonNull(value, "response");
    if (value.message().isBlank()) {
      throw new NdResponseHandlerException(
          "ResponseHandler.response must have a MESSAGE. Got: " + value + ".");
    }
    if (value.statusCode() <= 0) {
      throw new NdResponseHandlerException(
          "ResponseHandler.response must have a RETURN_CODE. Got: " + value + ".");
    }
    this.response = value;
    this.result = null;
    return this;
  }

  /**
   * Sets the controller response from its dictionary form ({@code RETURN_CODE}, {@code MESSAGE},
   * and optionally {@code DATA}, {@code METHOD}, {@code REQUEST_PATH}, {@code ERROR}).
   *
   * @param value the response map
   * @return this handler
   * @throws NdResponseHandlerException if {@code RETURN_CODE} or {@code MESSAGE} is missing
   */
  public ResponseHandler response(Map<String, Object> value) {
    Objects.requireNonNull(value, "response");
    if (!(value.get("MESSAGE") instanceof String message)) {
      throw new NdResponseHandlerException(
          "ResponseHandler.response must have a MESSAGE key. Got: " + value + ".");
    }
    if (!(value.get("RETURN_CODE") instanceof Number returnCode)) {
      throw new NdResponseHandlerException(
          "ResponseHandler.response must have a RETURN_CODE key. Got: " + value + ".");
    }
    Object data = value.get("DATA") != null ? value.get("DATA") : Map.of();
    Object error = value.get(ControllerResponse.ERROR_FIELD);
    if (error == null && data instanceof Map<?, ?> dataMap) {
      error = dataMap.get(ControllerResponse.ERROR_FIELD);
    }
    return response(
        new ControllerResponse(
            returnCode.intValue(),
            message,
            data,
            String.valueOf(value.getOrDefault("METHOD", "")),
            String.valueOf(value.getOrDefault("REQUEST_PATH", "")),
            error));
  }

  /**
   * Classifies the response.
   *
   * @return the outcome, also available from {@link #getResult()}
   * @throws NdResponseHandlerException if the response or verb has not been set
   */
  public ResponseOutcome commit() {
    if (response == null) {
      throw new NdResponseHandlerException(
          "ResponseHandler.response must be set prior to calling ResponseHandler.commit");
    }
    if (verb == null) {
      throw new NdResponseHandlerException(
          "ResponseHandler.verb must be set prior to calling ResponseHandler.commit");
    }
    ResponseOutcome outcome =
        verb == HttpVerb.GET ? classifyGet(response) : classifyChange(response);
    diagnostics.debug(
        "ResponseHandler.commit: verb " + verb + ", RETURN_CODE " + response.statusCode()
            + ", result " + outcome);
    result = outcome;
    return outcome;
  }

  /**
   * Returns the outcome of the last {@link #commit()}.
   *
   * @throws IllegalStateException if {@link #commit()} has not been called since the inputs were
   *     last set
   */
  public ResponseOutcome getResult() {
    if (result == null) {
      throw new IllegalStateException("Call ResponseHandler.commit before accessing result");
    }
    return result;
  }

  static QueryOutcome classifyGet(ControllerResponse response) {
    if (response.statusCode() == 404 && MESSAGE_NOT_FOUND.equals(response.message())) {
      return new QueryOutcome(false, true);
    }
    if (!SUCCESS_STATUS_CODES.contains(response.statusCode())
        || !MESSAGE_OK.equals(response.message())) {
      return new QueryOutcome(false, false);
    }
    return new QueryOutcome(true, true);
  }

  static ChangeOutcome classifyChange(ControllerResponse response) {
    if (response.hasError()) {
      return new ChangeOutcome(false, false);
    }
    if (!MESSAGE_OK.equals(response.message())) {
      return new ChangeOutcome(false, false);
    }
    return new ChangeOutcome(true, true);
  }
}
