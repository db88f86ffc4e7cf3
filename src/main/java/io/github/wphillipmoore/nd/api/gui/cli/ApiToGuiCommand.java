package io.github.wphillipmoore.nd.api.gui.cli;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import io.github.wphillipmoore.nd.api.gui.HttpClientTransport;
import io.github.wphillipmoore.nd.api.gui.NdRestTransport;
import io.github.wphillipmoore.nd.api.gui.RestSend;
import io.github.wphillipmoore.nd.api.gui.exception.NdRestException;
import io.github.wphillipmoore.nd.api.gui.mapping.GuiField;
import io.github.wphillipmoore.nd.api.gui.mapping.RestApiToGui;
import io.github.wphillipmoore.nd.api.gui.results.Results;
import java.io.PrintStream;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the mapping between the REST API keys of a template and the GUI field names.
 *
 * <pre>
 * export ND_IP4=192.168.1.1
 * export ND_DOMAIN=local
 * export ND_PASSWORD=MySecretPassword
 * export ND_USERNAME=admin
 * java ... ApiToGuiCommand --template-name MSD_Fabric
 * </pre>
 *
 * <p>Some templates to try: {@code Default_Network_Universal}, {@code Default_VRF_Universal},
 * {@code Easy_Fabric}, {@code Easy_Fabric_Classic}, {@code ERSPAN}, {@code MSD_Fabric}.
 */
public final class ApiToGuiCommand {

  private static final Logger LOG = LoggerFactory.getLogger("nd.ApiToGuiCommand");

  static final String DEFAULT_TEMPLATE = "MSD_Fabric";
  static final String PROGRAM_NAME = "ApiToGuiCommand";

  /** Command-line options. */
  static final class Options {

    @Parameter(names = "--template-name", description = "Template name to query")
    String templateName = DEFAULT_TEMPLATE;

    @Parameter(
        names = {"-h", "--help"},
        help = true,
        description = "Show this help message and exit")
    boolean help;
  }

  /** Entry point. */
  public static void main(String[] args) {
    System.exit(run(args, System.getenv(), new HttpClientTransport(), System.out, System.err));
  }

  static int run(
      String[] args,
      Map<String, String> environment,
      NdRestTransport transport,
      PrintStream out,
      PrintStream err) {
    Options options = new Options();
    JCommander commander =
        JCommander.newBuilder().programName(PROGRAM_NAME).addObject(options).build();
    try {
      commander.parse(args);
    } catch (ParameterException e) {
      err.println("error: " + e.getMessage());
      err.print(usage(commander));
      return 2;
    }
    if (options.help) {
      out.print(usage(commander));
      return 0;
    }
    String templateName = options.templateName;

    Results results = CommandEnvironment.queryResults(RestApiToGui.ACTION);
    RestApiToGui mapping;
    try {
      RestSend restSend = new CommandEnvironment(environment, transport).connect(results);
      mapping = new RestApiToGui(restSend);
      mapping.commit(templateName);
    } catch (NdRestException e) {
      err.println("Error occurred: " + e.getMessage());
      return 1;
    } finally {
      LOG.debug("Final result: {}", results.buildFinalResult());
    }

    out.println(
        "If GUI Section is blank, the parameter is likely located in General Parameters.");
    for (String parameterName : mapping.getParameterNames()) {
      GuiField field = mapping.field(parameterName);
      if (!field.hasDisplayName()) {
        continue;
      }
      out.println(
          "API Key: "
              + parameterName
              + ":\n  Description: "
              + field.description()
              + "\n  GUI Section: "
              + field.section()
              + "\n  GUI Field Name: "
              + field.displayName()
              + "\n");
    }
    return 0;
  }

  private static String usage(JCommander commander) {
    StringBuilder usage = new StringBuilder();
    commander.getUsageFormatter().usage(usage);
    return usage.toString();
  }

  private ApiToGuiCommand() {}
}
