package io.github.wphillipmoore.nd.api.gui.response;

/**
 * Outcome of a GET call.
 *
 * <p>{@code found=false, success=true} means the query succeeded and the resource is absent.
 *
 * @param found whether the resource exists
 * @param success whether the query succeeded
 */
public record QueryOutcome(boolean found, boolean success) implements ResponseOutcome {}
