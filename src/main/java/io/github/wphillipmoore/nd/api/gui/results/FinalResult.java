package io.github.wphillipmoore.nd.api.gui.results;

import io.github.wphillipmoore.nd.api.gui.response.ResponseOutcome;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Summary of every controller call made for one action.
 *
 * @param action the action name
 * @param operationType the kind of operation
 * @param changed whether any call changed the controller (always false for queries)
 * @param failed whether any call failed
 * @param responses the responses in dictionary form, in call order
 * @param results the outcomes, in call order
 */
public record FinalResult(
    String action,
    OperationType operationType,
    boolean changed,
    boolean failed,
    List<Map<String, Object>> responses,
    List<ResponseOutcome> results) {

  /** Validates non-null fields and defensively copies the lists. */
  public FinalResult {
    Objects.requireNonNull(action, "action");
    Objects.requireNonNull(operationType, "operationType");
    responses = List.copyOf(Objects.requireNonNull(responses, "responses"));
    results = List.copyOf(Objects.requireNonNull(results, "results"));
  }
}
