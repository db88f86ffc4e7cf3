package io.github.wphillipmoore.nd.api.gui;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/** Template documents captured from a controller, loaded from {@code src/test/resources}. */
public final class TemplateFixtures {

  private static final Gson GSON = new Gson();

  /** Returns the raw JSON of the {@code Easy_Fabric} template. */
  public static String easyFabricJson() {
    try (InputStream in =
        TemplateFixtures.class.getResourceAsStream("/templates/Easy_Fabric.json")) {
      if (in == null) {
        throw new IllegalStateException("Missing fixture templates/Easy_Fabric.json");
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Returns the {@code Easy_Fabric} template parsed the way the session parses bodies. */
  public static Map<String, Object> easyFabric() {
    return GSON.fromJson(easyFabricJson(), new TypeToken<Map<String, Object>>() {}.getType());
  }

  private TemplateFixtures() {}
}
