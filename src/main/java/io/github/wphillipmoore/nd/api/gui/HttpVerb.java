package io.github.wphillipmoore.nd.api.gui;

import java.util.Locale;
import org.jspecify.annotations.Nullable;

/** HTTP methods accepted by the controller and by the response classification rules. */
public enum HttpVerb {
  GET,
  POST,
  PUT,
  DELETE;

  /**
   * Looks up a verb by name (case-insensitive).
   *
   * @param name the verb name, may be null
   * @return the verb, or {@code null} if the name is not one of GET, POST, PUT, DELETE
   */
  public static @Nullable HttpVerb find(@Nullable String name) {
    if (name == null) {
      return null;
    }
    String upper = name.strip().toUpperCase(Locale.ROOT);
    for (HttpVerb verb : values()) {
      if (verb.name().equals(upper)) {
        return verb;
      }
    }
    return null;
  }
}
