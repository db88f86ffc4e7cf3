package io.github.wphillipmoore.nd.api.gui.diagnostics;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class DiagnosticSinkTest {

  @Test
  void defaultMethodsForwardLevel() {
    List<DiagnosticLevel> levels = new ArrayList<>();
    DiagnosticSink sink = (level, message) -> levels.add(level);

    sink.debug("a");
    sink.error("b");

    assertThat(levels).containsExactly(DiagnosticLevel.DEBUG, DiagnosticLevel.ERROR);
  }

  @Test
  void noopAcceptsMessages() {
    DiagnosticSink sink = DiagnosticSink.noop();

    sink.log(DiagnosticLevel.ERROR, "ignored");

    assertThat(sink).isNotNull();
  }
}
