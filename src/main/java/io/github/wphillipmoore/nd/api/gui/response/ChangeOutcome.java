package io.github.wphillipmoore.nd.api.gui.response;

/**
 * Outcome of a POST, PUT or DELETE call.
 *
 * @param changed whether the controller state was mutated
 * @param success whether the call succeeded
 */
public record ChangeOutcome(boolean changed, boolean success) implements ResponseOutcome {}
