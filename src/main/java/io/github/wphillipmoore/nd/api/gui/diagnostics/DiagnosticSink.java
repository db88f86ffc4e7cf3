package io.github.wphillipmoore.nd.api.gui.diagnostics;

/**
 * Destination for diagnostic messages emitted by the session, the response handler and the
 * orchestration layer.
 *
 * <p>Injected at construction so the core never depends on a process-wide logger. Use {@link
 * Slf4jDiagnosticSink} for real output and {@link #noop()} when nothing should be recorded.
 */
@FunctionalInterface
public interface DiagnosticSink {

  /**
   * Records a message.
   *
   * @param level the severity
   * @param message the message text
   */
  void log(DiagnosticLevel level, String message);

  /** Records a {@link DiagnosticLevel#DEBUG} message. */
  default void debug(String message) {
    log(DiagnosticLevel.DEBUG, message);
  }

  /** Records a {@link DiagnosticLevel#ERROR} message. */
  default void error(String message) {
    log(DiagnosticLevel.ERROR, message);
  }

  /** Returns a sink that discards every message. */
  static DiagnosticSink noop() {
    return (level, message) -> {};
  }
}
