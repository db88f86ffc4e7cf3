package io.github.wphillipmoore.nd.api.gui.results;

import io.github.wphillipmoore.nd.api.gui.ControllerResponse;
import io.github.wphillipmoore.nd.api.gui.response.ChangeOutcome;
import io.github.wphillipmoore.nd.api.gui.response.ResponseOutcome;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Accumulates the responses and outcomes of the controller calls made for one action.
 *
 * <p>Not thread-safe.
 */
public final class Results {

  private final String action;
  private final OperationType operationType;
  private final List<Map<String, Object>> responses = new ArrayList<>();
  private final List<ResponseOutcome> results = new ArrayList<>();
  private final Set<Boolean> changed = new LinkedHashSet<>();
  private final Set<Boolean> failed = new LinkedHashSet<>();

  /**
   * Creates an empty accumulator.
   *
   * @param action the action name, e.g. {@code rest_api_to_gui}
   * @param operationType the kind of operation
   */
  public Results(String action, OperationType operationType) {
    this.action = Objects.requireNonNull(action, "action");
    this.operationType = Objects.requireNonNull(operationType, "operationType");
  }

  /**
   * Records one call.
   *
   * @param response the raw response
   * @param outcome its classification
   */
  public void add(ControllerResponse response, ResponseOutcome outcome) {
    Objects.requireNonNull(response, "response");
    Objects.requireNonNull(outcome, "outcome");
    responses.add(response.toMap());
    results.add(outcome);
    changed.add(outcome instanceof ChangeOutcome change && change.changed());
    failed.add(!outcome.success());
  }

  /** Returns the recorded responses in dictionary form. The list is unmodifiable. */
  public List<Map<String, Object>> getResponses() {
    return Collections.unmodifiableList(responses);
  }

  /** Returns the recorded outcomes. The list is unmodifiable. */
  public List<ResponseOutcome> getResults() {
    return Collections.unmodifiableList(results);
  }

  /** Returns the distinct changed flags seen so far. The set is unmodifiable. */
  public Set<Boolean> getChanged() {
    return Collections.unmodifiableSet(changed);
  }

  /** Returns the distinct failed flags seen so far. The set is unmodifiable. */
  public Set<Boolean> getFailed() {
    return Collections.unmodifiableSet(failed);
  }

  public String getAction() {
    return action;
  }

  public OperationType getOperationType() {
    return operationType;
  }

  /** Builds the summary of all calls recorded so far. */
  public FinalResult buildFinalResult() {
    boolean anyChanged = operationType != OperationType.QUERY && changed.contains(Boolean.TRUE);
    return new FinalResult(
        action,
        operationType,
        anyChanged,
        failed.contains(Boolean.TRUE),
        responses,
        results);
  }
}
