package io.github.wphillipmoore.nd.api.gui.template;

import io.github.wphillipmoore.nd.api.gui.ControllerRequest;
import io.github.wphillipmoore.nd.api.gui.exception.NdConfigurationException;
import org.jspecify.annotations.Nullable;

/** Controller endpoints for configuration templates. */
public final class TemplateEndpoints {

  /** Path of the template collection. */
  public static final String TEMPLATES_PATH =
      "/appcenter/cisco/ndfc/api/v1/configtemplate/rest/config/templates";

  /** Returns the request that lists every template the controller supports. */
  public static ControllerRequest templates() {
    return ControllerRequest.get(TEMPLATES_PATH);
  }

  /**
   * Returns the request that retrieves one template.
   *
   * @param templateName the template name, e.g. {@code Easy_Fabric}
   * @return the request
   * @throws NdConfigurationException if the name is blank
   */
  public static ControllerRequest template(@Nullable String templateName) {
    if (templateName == null || templateName.isBlank()) {
      throw new NdConfigurationException("template_name must be set.");
    }
    return ControllerRequest.get(TEMPLATES_PATH + "/" + templateName.strip());
  }

  private TemplateEndpoints() {}
}
