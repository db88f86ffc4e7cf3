package io.github.wphillipmoore.nd.api.gui.template;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Parses the {@code parameters} list of a template document into {@link ParameterInfo} records.
 *
 * <p>Annotation values arrive as strings that are often wrapped in literal double quotes (for
 * example {@code "\"Fabric Name\""}); the quotes are removed.
 */
public final class ParamInfo {

  static final String PARAMETERS = "parameters";
  static final String ANNOTATIONS = "annotations";

  private final Map<String, ParameterInfo> parameters;
  private final boolean raiseOnMissing;

  private ParamInfo(Map<String, ParameterInfo> parameters, boolean raiseOnMissing) {
    this.parameters = parameters;
    this.raiseOnMissing = raiseOnMissing;
  }

  /**
   * Parses a template document. Lookups of unknown parameters fail.
   *
   * @param template the template document
   * @return the parsed parameter metadata
   * @throws IllegalArgumentException if the template has no {@code parameters} list
   */
  public static ParamInfo parse(Map<String, Object> template) {
    Objects.requireNonNull(template, "template");
    if (!(template.get(PARAMETERS) instanceof List<?> list)) {
      throw new IllegalArgumentException("template has no parameters list");
    }
    Map<String, ParameterInfo> parsed = new LinkedHashMap<>();
    for (Object item : list) {
      if (item instanceof Map<?, ?> parameter && parameter.get("name") instanceof String name) {
        parsed.put(name, toParameterInfo(name, parameter));
      }
    }
    return new ParamInfo(Collections.unmodifiableMap(parsed), true);
  }

  /**
   * Returns a copy whose lookups of unknown parameters return {@link ParameterInfo#empty(String)}
   * instead of failing.
   */
  public ParamInfo raiseOnMissing(boolean value) {
    return new ParamInfo(parameters, value);
  }

  /** Returns the parameter names in template order. */
  public List<String> parameterNames() {
    return new ArrayList<>(parameters.keySet());
  }

  /**
   * Looks up a parameter.
   *
   * @param name the REST API key
   * @return the metadata
   * @throws IllegalArgumentException if the parameter is unknown and lookups are strict
   */
  public ParameterInfo lookup(String name) {
    ParameterInfo info = parameters.get(name);
    if (info != null) {
      return info;
    }
    if (raiseOnMissing) {
      throw new IllegalArgumentException("Parameter " + name + " not found in template");
    }
    return ParameterInfo.empty(name);
  }

  private static ParameterInfo toParameterInfo(String name, Map<?, ?> parameter) {
    Map<?, ?> annotations =
        parameter.get(ANNOTATIONS) instanceof Map<?, ?> map ? map : Map.of();
    return new ParameterInfo(
        name,
        text(annotations.get("Description")),
        text(annotations.get("DisplayName")),
        text(annotations.get("Section")),
        Boolean.parseBoolean(text(annotations.get("IsInternal"))),
        text(parameter.get("parameterType")),
        text(parameter.get("defaultValue")),
        Boolean.parseBoolean(text(parameter.get("optional"))));
  }

  static String text(@Nullable Object value) {
    if (value == null) {
      return "";
    }
    String text = String.valueOf(value).strip();
    if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
      text = text.substring(1, text.length() - 1).strip();
    }
    return text;
  }
}
