package io.github.wphillipmoore.nd.api.gui.cli;

import io.github.wphillipmoore.nd.api.gui.HttpClientTransport;
import io.github.wphillipmoore.nd.api.gui.NdRestTransport;
import io.github.wphillipmoore.nd.api.gui.RestSend;
import io.github.wphillipmoore.nd.api.gui.exception.NdRestException;
import io.github.wphillipmoore.nd.api.gui.results.Results;
import io.github.wphillipmoore.nd.api.gui.template.TemplateNames;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Prints the names of every template the controller supports, one per line. */
public final class TemplateNamesCommand {

  private static final Logger LOG = LoggerFactory.getLogger("nd.TemplateNamesCommand");

  static final String ACTION = "template_names";

  /** Entry point. */
  public static void main(String[] args) {
    System.exit(run(System.getenv(), new HttpClientTransport(), System.out, System.err));
  }

  static int run(
      Map<String, String> environment,
      NdRestTransport transport,
      PrintStream out,
      PrintStream err) {
    Results results = CommandEnvironment.queryResults(ACTION);
    List<String> names;
    try {
      RestSend restSend = new CommandEnvironment(environment, transport).connect(results);
      names = new TemplateNames(restSend).refresh();
    } catch (NdRestException e) {
      err.println("Error occurred: " + e.getMessage());
      return 1;
    } finally {
      LOG.debug("Final result: {}", results.buildFinalResult());
    }
    for (String name : names) {
      out.println("- " + name);
    }
    return 0;
  }

  private TemplateNamesCommand() {}
}
