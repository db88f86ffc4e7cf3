package io.github.wphillipmoore.nd.api.gui.template;

import io.github.wphillipmoore.nd.api.gui.ControllerResponse;
import io.github.wphillipmoore.nd.api.gui.RestSend;
import io.github.wphillipmoore.nd.api.gui.SendPolicy;
import io.github.wphillipmoore.nd.api.gui.exception.NdControllerResponseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Retrieves the names of every template the controller supports.
 *
 * <p>Endpoint: {@code GET /appcenter/cisco/ndfc/api/v1/configtemplate/rest/config/templates}.
 */
public final class TemplateNames {

  static final SendPolicy POLICY = new SendPolicy().withTimeoutSeconds(2);

  private final RestSend restSend;
  private List<String> templateNames = List.of();

  public TemplateNames(RestSend restSend) {
    this.restSend = Objects.requireNonNull(restSend, "restSend");
  }

  /**
   * Retrieves the template names from the controller.
   *
   * @return the names, in controller order
   * @throws NdControllerResponseException if the controller does not answer 200
   */
  public List<String> refresh() {
    restSend.commit(TemplateEndpoints.templates(), POLICY);
    ControllerResponse response = restSend.getResponseCurrent();
    if (response.statusCode() != 200) {
      throw new NdControllerResponseException(
          "Failed to retrieve template_names. RETURN_CODE: "
              + response.statusCode()
              + ". MESSAGE: "
              + response.message()
              + ".",
          response.statusCode(),
          response.message(),
          response.data());
    }
    List<String> names = new ArrayList<>();
    for (Object item : response.dataAsList()) {
      if (item instanceof Map<?, ?> template && template.get("name") instanceof String name) {
        names.add(name);
      }
    }
    templateNames = List.copyOf(names);
    return templateNames;
  }

  /** Returns the names retrieved by the last {@link #refresh()}. */
  public List<String> getTemplateNames() {
    return templateNames;
  }
}
