package io.github.wphillipmoore.nd.api.gui.cli;

import io.github.wphillipmoore.nd.api.gui.ControllerSession;
import io.github.wphillipmoore.nd.api.gui.NdRestTransport;
import io.github.wphillipmoore.nd.api.gui.RestSend;
import io.github.wphillipmoore.nd.api.gui.auth.ControllerCredentials;
import io.github.wphillipmoore.nd.api.gui.diagnostics.Slf4jDiagnosticSink;
import io.github.wphillipmoore.nd.api.gui.exception.NdConfigurationException;
import io.github.wphillipmoore.nd.api.gui.response.ResponseHandler;
import io.github.wphillipmoore.nd.api.gui.results.OperationType;
import io.github.wphillipmoore.nd.api.gui.results.Results;
import java.util.Map;
import java.util.Objects;

/** Builds a logged-in {@link RestSend} from {@code ND_*} environment variables. */
final class CommandEnvironment {

  static final String ENV_TIMEOUT = "ND_TIMEOUT";

  private final Map<String, String> environment;
  private final NdRestTransport transport;

  CommandEnvironment(Map<String, String> environment, NdRestTransport transport) {
    this.environment = Objects.requireNonNull(environment, "environment");
    this.transport = Objects.requireNonNull(transport, "transport");
  }

  /**
   * Creates a session, logs in and wraps the session in a {@link RestSend}.
   *
   * @param results accumulator for the calls made by the command
   * @return the orchestrator
   * @throws NdConfigurationException if the controller address or password is missing
   */
  RestSend connect(Results results) {
    ControllerCredentials credentials = ControllerCredentials.fromEnvironment(environment);
    if (credentials.host().isEmpty() || credentials.password().isEmpty()) {
      throw new NdConfigurationException(
          ControllerCredentials.ENV_IP4
              + " (or "
              + ControllerCredentials.ENV_IP6
              + "), "
              + ControllerCredentials.ENV_PASSWORD
              + ", and "
              + ControllerCredentials.ENV_USERNAME
              + " must be set");
    }
    ControllerSession.Builder builder =
        new ControllerSession.Builder(credentials).transport(transport);
    String timeout = environment.get(ENV_TIMEOUT);
    if (timeout != null && !timeout.isBlank()) {
      builder.timeoutSeconds(timeout);
    }
    ControllerSession session = builder.build();
    session.login();
    return new RestSend(
            session, new ResponseHandler(Slf4jDiagnosticSink.forClass(ResponseHandler.class)))
        .results(results);
  }

  static Results queryResults(String action) {
    return new Results(action, OperationType.QUERY);
  }
}
