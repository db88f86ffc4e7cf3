package io.github.wphillipmoore.nd.api.gui.mapping;

import java.util.Objects;

/**
 * Where a REST API key appears in the controller GUI.
 *
 * <p>Absent attributes are empty strings. An empty {@code section} usually means the field is on
 * the General Parameters tab.
 *
 * @param description the parameter description
 * @param displayName the GUI field label
 * @param section the GUI tab
 */
public record GuiField(String description, String displayName, String section) {

  /** Validates that all fields are non-null. */
  public GuiField {
    Objects.requireNonNull(description, "description");
    Objects.requireNonNull(displayName, "displayName");
    Objects.requireNonNull(section, "section");
  }

  /** Returns a field with no attributes. */
  public static GuiField empty() {
    return new GuiField("", "", "");
  }

  /** Returns {@code true} if the field has a GUI label. */
  public boolean hasDisplayName() {
    return !displayName.isBlank();
  }
}
