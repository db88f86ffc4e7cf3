package io.github.wphillipmoore.nd.api.gui;

/**
 * How long {@link RestSend} keeps re-sending an unsuccessful request, and how long it waits
 * between attempts.
 *
 * <p>An attempt is always made; further attempts are made only while the next one would still
 * start inside {@code timeoutSeconds}.
 *
 * @param timeoutSeconds total time budget in seconds (must be &gt; 0)
 * @param sendIntervalSeconds pause between attempts in seconds (must be &gt; 0)
 */
public record SendPolicy(double timeoutSeconds, double sendIntervalSeconds) {

  /** Default time budget in seconds (300). */
  public static final double DEFAULT_TIMEOUT_SECONDS = 300.0;

  /** Default pause between attempts in seconds (5). */
  public static final double DEFAULT_SEND_INTERVAL_SECONDS = 5.0;

  /**
   * Creates a policy.
   *
   * @throws IllegalArgumentException if either value is not positive
   */
  public SendPolicy {
    if (timeoutSeconds <= 0) {
      throw new IllegalArgumentException("timeoutSeconds must be > 0");
    }
    if (sendIntervalSeconds <= 0) {
      throw new IllegalArgumentException("sendIntervalSeconds must be > 0");
    }
  }

  /** Creates a policy with default values (300s budget, 5s interval). */
  public SendPolicy() {
    this(DEFAULT_TIMEOUT_SECONDS, DEFAULT_SEND_INTERVAL_SECONDS);
  }

  /** Returns a policy with the same interval and a different budget. */
  public SendPolicy withTimeoutSeconds(double value) {
    return new SendPolicy(value, sendIntervalSeconds);
  }
}
