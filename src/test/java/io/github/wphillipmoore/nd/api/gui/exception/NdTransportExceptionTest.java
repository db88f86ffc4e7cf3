package io.github.wphillipmoore.nd.api.gui.exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class NdTransportExceptionTest {

  @Test
  void constructWithoutCause() {
    NdTransportException ex = new NdTransportException("fail", "https://10.1.1.1/login");
    assertThat(ex.getMessage()).isEqualTo("fail");
    assertThat(ex.getUrl()).isEqualTo("https://10.1.1.1/login");
    assertThat(ex.getCause()).isNull();
  }

  @Test
  void constructWithCause() {
    Throwable cause = new RuntimeException("root");
    NdTransportException ex = new NdTransportException("fail", "https://10.1.1.1/x", cause);
    assertThat(ex.getCause()).isSameAs(cause);
  }

  @Test
  void nullUrlThrows() {
    assertThatThrownBy(() -> new NdTransportException("fail", null))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("url");
  }
}
