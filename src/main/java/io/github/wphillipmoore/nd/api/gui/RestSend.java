package io.github.wphillipmoore.nd.api.gui;

import io.github.wphillipmoore.nd.api.gui.diagnostics.DiagnosticSink;
import io.github.wphillipmoore.nd.api.gui.diagnostics.Slf4jDiagnosticSink;
import io.github.wphillipmoore.nd.api.gui.exception.NdConfigurationException;
import io.github.wphillipmoore.nd.api.gui.exception.NdTransportException;
import io.github.wphillipmoore.nd.api.gui.response.ResponseHandler;
import io.github.wphillipmoore.nd.api.gui.response.ResponseOutcome;
import io.github.wphillipmoore.nd.api.gui.results.Results;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Sends one logical request through a {@link Sender} and classifies it with a {@link
 * ResponseHandler}.
 *
 * <p>Unsuccessful outcomes are re-sent every {@link SendPolicy#sendIntervalSeconds()} until one
 * succeeds or the {@link SendPolicy#timeoutSeconds()} budget is spent; the last response and
 * outcome are kept either way. In check mode, requests other than GET are not sent and a simulated
 * {@code 200 OK} response is classified instead.
 *
 * <p>Not thread-safe.
 */
public final class RestSend {

  private final Sender sender;
  private final ResponseHandler responseHandler;
  private final DiagnosticSink diagnostics;

  private Clock clock = new SystemClock();
  private SendPolicy policy = new SendPolicy();
  private boolean checkMode;
  private @Nullable Results results;
  private @Nullable ControllerResponse responseCurrent;
  private @Nullable ResponseOutcome resultCurrent;

  /** Clock abstraction for testability. */
  interface Clock {
    void sleep(double seconds) throws InterruptedException;

    double elapsedSeconds();

    void reset();
  }

  /** Real clock using System.nanoTime and Thread.sleep. */
  static final class SystemClock implements Clock {
    private long startNanos;

    SystemClock() {
      reset();
    }

    @Override
    public void sleep(double seconds) throws InterruptedException {
      Thread.sleep((long) (seconds * 1000));
    }

    @Override
    public double elapsedSeconds() {
      return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    @Override
    public void reset() {
      startNanos = System.nanoTime();
    }
  }

  /**
   * Creates an orchestrator logging to {@code nd.RestSend}.
   *
   * @param sender the sender requests go through
   * @param responseHandler the classifier applied to every response
   */
  public RestSend(Sender sender, ResponseHandler responseHandler) {
    this(sender, responseHandler, Slf4jDiagnosticSink.forClass(RestSend.class));
  }

  /**
   * Creates an orchestrator.
   *
   * @param sender the sender requests go through
   * @param responseHandler the classifier applied to every response
   * @param diagnostics sink for orchestration messages
   */
  public RestSend(Sender sender, ResponseHandler responseHandler, DiagnosticSink diagnostics) {
    this.sender = Objects.requireNonNull(sender, "sender");
    this.responseHandler = Objects.requireNonNull(responseHandler, "responseHandler");
    this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
  }

  /** Package-private setter for test injection. */
  void setClock(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** Sets the re-send policy. Defaults to {@link SendPolicy#SendPolicy()}. */
  public RestSend policy(SendPolicy policy) {
    this.policy = Objects.requireNonNull(policy, "policy");
    return this;
  }

  /** Enables or disables check mode. Defaults to {@code false}. */
  public RestSend checkMode(boolean checkMode) {
    this.checkMode = checkMode;
    return this;
  }

  /** Sets the accumulator every committed call is recorded into, or {@code null} for none. */
  public RestSend results(@Nullable Results results) {
    this.results = results;
    return this;
  }

  /**
   * Sends the request and classifies the response.
   *
   * @param request the request
   * @return the outcome of the last attempt
   * @throws NdConfigurationException if the request has no verb, or the sender is misconfigured
   * @throws NdTransportException if the controller cannot be reached, or the wait between
   *     attempts is interrupted
   */
  public ResponseOutcome commit(ControllerRequest request) {
    return commit(request, policy);
  }

  /**
   * Sends the request under a one-off re-send policy and classifies the response.
   *
   * @param request the request
   * @param policy the re-send policy for this call only
   * @return the outcome of the last attempt
   * @throws NdConfigurationException if the request has no verb, or the sender is misconfigured
   * @throws NdTransportException if the controller cannot be reached, or the wait between
   *     attempts is interrupted
   */
  public ResponseOutcome commit(ControllerRequest request, SendPolicy policy) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(policy, "policy");
    HttpVerb verb = request.verb();
    if (verb == null) {
      throw new NdConfigurationException("verb must be set before calling RestSend.commit()");
    }

    ControllerResponse response;
    ResponseOutcome outcome;
    if (checkMode && verb != HttpVerb.GET) {
      response = simulatedResponse(request, verb);
      outcome = responseHandler.verb(verb).response(response).commit();
      diagnostics.debug("Check mode: simulated " + verb + " " + request.path());
    } else {
      clock.reset();
      int attempts = 0;
      while (true) {
        attempts++;
        response = sender.send(request);
        outcome = responseHandler.verb(verb).response(response).commit();
        if (outcome.success()) {
          break;
        }
        double elapsed = clock.elapsedSeconds();
        if (elapsed + policy.sendIntervalSeconds() > policy.timeoutSeconds()) {
          diagnostics.debug(
              "Giving up on " + verb + " " + request.path() + " after " + attempts
                  + " attempt(s), RETURN_CODE " + response.statusCode());
          break;
        }
        diagnostics.debug(
            "Attempt " + attempts + " of " + verb + " " + request.path()
                + " unsuccessful, RETURN_CODE " + response.statusCode()
                + ". Retrying in " + policy.sendIntervalSeconds() + "s.");
        try {
          clock.sleep(policy.sendIntervalSeconds());
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new NdTransportException(
              "Interrupted while waiting to resend request", String.valueOf(request.path()), e);
        }
      }
    }

    responseCurrent = response;
    resultCurrent = outcome;
    if (results != null) {
      results.add(response, outcome);
    }
    return outcome;
  }

  private static ControllerResponse simulatedResponse(ControllerRequest request, HttpVerb verb) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("CHECK_MODE", true);
    if (request.payload() != null) {
      data.put("payload", request.payload());
    }
    return ControllerResponse.of(200, "OK", data, verb.name(), String.valueOf(request.path()));
  }

  /**
   * Returns the raw response of the last {@link #commit(ControllerRequest)}.
   *
   * @throws IllegalStateException if nothing has been committed yet
   */
  public ControllerResponse getResponseCurrent() {
    if (responseCurrent == null) {
      throw new IllegalStateException("Call RestSend.commit before accessing responseCurrent");
    }
    return responseCurrent;
  }

  /**
   * Returns the outcome of the last {@link #commit(ControllerRequest)}.
   *
   * @throws IllegalStateException if nothing has been committed yet
   */
  public ResponseOutcome getResultCurrent() {
    if (resultCurrent == null) {
      throw new IllegalStateException("Call RestSend.commit before accessing resultCurrent");
    }
    return resultCurrent;
  }

  public SendPolicy getPolicy() {
    return policy;
  }

  public boolean isCheckMode() {
    return checkMode;
  }
}
