package io.github.wphillipmoore.nd.api.gui.mapping;

import io.github.wphillipmoore.nd.api.gui.RestSend;
import io.github.wphillipmoore.nd.api.gui.exception.NdConfigurationException;
import io.github.wphillipmoore.nd.api.gui.exception.NdControllerResponseException;
import io.github.wphillipmoore.nd.api.gui.template.ParamInfo;
import io.github.wphillipmoore.nd.api.gui.template.ParameterInfo;
import io.github.wphillipmoore.nd.api.gui.template.TemplateGet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;

/**
 * Builds a translation table from the REST API keys of a template to their GUI labels and
 * sections.
 *
 * <p>Parameters that never appear in the GUI are left out: internal parameters, parameters in the
 * {@code Hidden} section, and the bookkeeping keys containing {@code _PREV} or {@code DCNM_ID}.
 *
 * <pre>{@code
 * RestApiToGui mapping = new RestApiToGui(restSend);
 * mapping.commit("Easy_Fabric");
 * for (String key : mapping.getParameterNames()) {
 *   GuiField field = mapping.field(key);
 * }
 * }</pre>
 */
public final class RestApiToGui {

  /** Action name recorded in results. */
  public static final String ACTION = "rest_api_to_gui";

  static final String HIDDEN_SECTION = "Hidden";
  static final List<String> SKIPPED_KEY_FRAGMENTS = List.of("_PREV", "DCNM_ID");

  private final TemplateGet templateGet;
  private @Nullable Map<String, GuiField> mapping;

  public RestApiToGui(RestSend restSend) {
    this(new TemplateGet(Objects.requireNonNull(restSend, "restSend")));
  }

  RestApiToGui(TemplateGet templateGet) {
    this.templateGet = Objects.requireNonNull(templateGet, "templateGet");
  }

  /**
   * Retrieves the template and builds the mapping.
   *
   * @param templateName the template name, e.g. {@code MSD_Fabric}
   * @return the mapping keyed by REST API key, sorted, unmodifiable
   * @throws NdConfigurationException if the template name is blank
   * @throws NdControllerResponseException if the template cannot be retrieved or has no
   *     parameters list
   */
  public Map<String, GuiField> commit(@Nullable String templateName) {
    if (templateName == null || templateName.isBlank()) {
      throw new NdConfigurationException("template_name must be set.");
    }
    Map<String, Object> template = templateGet.refresh(templateName);
    ParamInfo paramInfo;
    try {
      paramInfo = ParamInfo.parse(template).raiseOnMissing(false);
    } catch (IllegalArgumentException e) {
      throw new NdControllerResponseException(
          "Template " + templateName + " has no parameters list", 200, "OK", template, e);
    }

    Map<String, GuiField> built = new TreeMap<>();
    for (String name : paramInfo.parameterNames()) {
      ParameterInfo info = paramInfo.lookup(name);
      if (skip(info)) {
        continue;
      }
      built.put(name, new GuiField(info.description(), info.displayName(), info.section()));
    }
    mapping = Collections.unmodifiableMap(built);
    return mapping;
  }

  static boolean skip(ParameterInfo info) {
    if (info.internal() || HIDDEN_SECTION.equals(info.section())) {
      return true;
    }
    for (String fragment : SKIPPED_KEY_FRAGMENTS) {
      if (info.name().contains(fragment)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the mapped REST API keys, sorted.
   *
   * @throws IllegalStateException if {@link #commit(String)} has not been called
   */
  public List<String> getParameterNames() {
    return new ArrayList<>(getMapping().keySet());
  }

  /**
   * Returns the mapping built by the last {@link #commit(String)}.
   *
   * @throws IllegalStateException if {@link #commit(String)} has not been called
   */
  public Map<String, GuiField> getMapping() {
    if (mapping == null) {
      throw new IllegalStateException("Call RestApiToGui.commit before accessing the mapping");
    }
    return mapping;
  }

  /**
   * Returns the GUI field of a REST API key, or {@link GuiField#empty()} if the key is not mapped.
   *
   * @throws IllegalStateException if {@link #commit(String)} has not been called
   */
  public GuiField field(String parameterName) {
    GuiField field = getMapping().get(parameterName);
    return field != null ? field : GuiField.empty();
  }
}
