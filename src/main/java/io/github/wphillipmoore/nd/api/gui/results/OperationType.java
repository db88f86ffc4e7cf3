package io.github.wphillipmoore.nd.api.gui.results;

/** Kind of operation a {@link Results} instance aggregates. */
public enum OperationType {

  /** Read-only; never reported as changed. */
  QUERY,

  CREATE,

  UPDATE,

  DELETE
}
