package io.github.wphillipmoore.nd.api.gui.template;

import java.util.Objects;

/**
 * Metadata of one template parameter, taken from its annotations.
 *
 * <p>Absent text attributes are empty strings.
 *
 * @param name the REST API key
 * @param description the {@code Description} annotation
 * @param displayName the {@code DisplayName} annotation (the GUI field label)
 * @param section the {@code Section} annotation (the GUI tab)
 * @param internal whether the {@code IsInternal} annotation is {@code true}
 * @param type the parameter type, e.g. {@code string} or {@code boolean}
 * @param defaultValue the default value as text
 * @param optional whether the parameter may be omitted
 */
public record ParameterInfo(
    String name,
    String description,
    String displayName,
    String section,
    boolean internal,
    String type,
    String defaultValue,
    boolean optional) {

  /** Validates that all text fields are non-null. */
  public ParameterInfo {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(description, "description");
    Objects.requireNonNull(displayName, "displayName");
    Objects.requireNonNull(section, "section");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(defaultValue, "defaultValue");
  }

  /** Returns a parameter with no metadata. */
  public static ParameterInfo empty(String name) {
    return new ParameterInfo(name, "", "", "", false, "", "", false);
  }
}
