package io.github.wphillipmoore.nd.api.gui.diagnostics;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DiagnosticSink} that forwards to an SLF4J logger named {@code nd.<component>}.
 *
 * <p>The binding (and therefore the output format and threshold) is chosen at deployment time; the
 * command-line tools ship with {@code slf4j-simple}.
 */
public final class Slf4jDiagnosticSink implements DiagnosticSink {

  static final String LOGGER_PREFIX = "nd.";

  private final Logger logger;

  /**
   * Creates a sink for the given component.
   *
   * @param component the component name, e.g. {@code ControllerSession}
   */
  public Slf4jDiagnosticSink(String component) {
    this(LoggerFactory.getLogger(LOGGER_PREFIX + Objects.requireNonNull(component, "component")));
  }

  /**
   * Creates a sink for the given class, using its simple name as the component.
   *
   * @param type the owning class
   * @return the sink
   */
  public static Slf4jDiagnosticSink forClass(Class<?> type) {
    return new Slf4jDiagnosticSink(type.getSimpleName());
  }

  Slf4jDiagnosticSink(Logger logger) {
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  @Override
  public void log(DiagnosticLevel level, String message) {
    if (level == DiagnosticLevel.ERROR) {
      logger.error(message);
    } else if (level == DiagnosticLevel.WARNING) {
      logger.warn(message);
    } else if (level == DiagnosticLevel.INFO) {
      logger.info(message);
    } else {
      logger.debug(message);
    }
  }

  /** Returns the underlying logger name. */
  public String getLoggerName() {
    return logger.getName();
  }
}
