package io.github.wphillipmoore.nd.api.gui.template;

import io.github.wphillipmoore.nd.api.gui.ControllerResponse;
import io.github.wphillipmoore.nd.api.gui.RestSend;
import io.github.wphillipmoore.nd.api.gui.SendPolicy;
import io.github.wphillipmoore.nd.api.gui.exception.NdConfigurationException;
import io.github.wphillipmoore.nd.api.gui.exception.NdControllerResponseException;
import java.util.Map;
import java.util.Objects;

/**
 * Retrieves one template document from the controller.
 *
 * <p>Endpoint: {@code GET
 * /appcenter/cisco/ndfc/api/v1/configtemplate/rest/config/templates/<name>}.
 */
public final class TemplateGet {

  static final SendPolicy POLICY = new SendPolicy().withTimeoutSeconds(2);

  private final RestSend restSend;
  private Map<String, Object> template = Map.of();

  public TemplateGet(RestSend restSend) {
    this.restSend = Objects.requireNonNull(restSend, "restSend");
  }

  /**
   * Retrieves a template.
   *
   * @param templateName the template name
   * @return the template document, unmodifiable
   * @throws NdConfigurationException if the name is blank
   * @throws NdControllerResponseException if the controller does not answer 200 with an object
   */
  public Map<String, Object> refresh(String templateName) {
    restSend.commit(TemplateEndpoints.template(templateName), POLICY);
    ControllerResponse response = restSend.getResponseCurrent();
    if (response.statusCode() != 200 || !(response.data() instanceof Map)) {
      throw new NdControllerResponseException(
          "Failed to retrieve template "
              + templateName
              + ". RETURN_CODE: "
              + response.statusCode()
              + ". MESSAGE: "
              + response.message()
              + ".",
          response.statusCode(),
          response.message(),
          response.data());
    }
    template = response.dataAsMap();
    return template;
  }

  /** Returns the template retrieved by the last {@link #refresh(String)}. */
  public Map<String, Object> getTemplate() {
    return template;
  }
}
