package io.github.wphillipmoore.nd.api.gui;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class HttpVerbTest {

  @Test
  void findIgnoresCaseAndWhitespace() {
    assertThat(HttpVerb.find("get")).isEqualTo(HttpVerb.GET);
    assertThat(HttpVerb.find(" Delete ")).isEqualTo(HttpVerb.DELETE);
  }

  @Test
  void findReturnsNullForUnknownNames() {
    assertThat(HttpVerb.find("PATCH")).isNull();
    assertThat(HttpVerb.find("")).isNull();
    assertThat(HttpVerb.find(null)).isNull();
  }
}
