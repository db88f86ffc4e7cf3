package io.github.wphillipmoore.nd.api.gui;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.wphillipmoore.nd.api.gui.auth.ControllerCredentials;
import io.github.wphillipmoore.nd.api.gui.mapping.RestApiToGui;
import io.github.wphillipmoore.nd.api.gui.response.ResponseHandler;
import io.github.wphillipmoore.nd.api.gui.template.TemplateNames;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;

/**
 * Integration tests that exercise a live Nexus Dashboard controller.
 *
 * <p>Gated by the {@code ND_RUN_INTEGRATION} environment variable. The controller address and
 * credentials are read from {@code ND_IP4} (or {@code ND_IP6}), {@code ND_USERNAME}, {@code
 * ND_PASSWORD} and {@code ND_DOMAIN}.
 */
@EnabledIfEnvironmentVariable(named = "ND_RUN_INTEGRATION", matches = ".+")
class ControllerSessionIT {

  static ControllerSession session;
  static RestSend restSend;

  @BeforeAll
  static void setUp() {
    session =
        new ControllerSession.Builder(ControllerCredentials.fromEnvironment(System.getenv()))
            .build();
    session.login();
    restSend = new RestSend(session, new ResponseHandler());
  }

  @Test
  void loginIssuesToken() {
    assertThat(session.isAuthenticated()).isTrue();
    assertThat(session.getToken()).isNotBlank();
  }

  @Test
  void listsTemplates() {
    assertThat(new TemplateNames(restSend).refresh()).contains("Easy_Fabric");
  }

  @Test
  void mapsEasyFabric() {
    RestApiToGui mapping = new RestApiToGui(restSend);

    mapping.commit("Easy_Fabric");

    assertThat(mapping.field("FABRIC_NAME").displayName()).isEqualTo("Fabric Name");
  }
}
