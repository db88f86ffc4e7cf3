package io.github.wphillipmoore.nd.api.gui.response;

/**
 * Normalized outcome of a controller call.
 *
 * <p>GET calls produce a {@link QueryOutcome}; POST, PUT and DELETE calls produce a {@link
 * ChangeOutcome}. Both report whether the call itself succeeded.
 */
public sealed interface ResponseOutcome permits QueryOutcome, ChangeOutcome {

  /** Returns {@code true} if the call itself succeeded. */
  boolean success();
}
