package io.github.wphillipmoore.nd.api.gui.diagnostics;

/** Severity of a diagnostic message. */
public enum DiagnosticLevel {
  DEBUG,
  INFO,
  WARNING,
  ERROR
}
