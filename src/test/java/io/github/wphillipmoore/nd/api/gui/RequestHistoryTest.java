package io.github.wphillipmoore.nd.api.gui;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class RequestHistoryTest {

  @Test
  void startsEmpty() {
    RequestHistory history = new RequestHistory();

    assertThat(history.size()).isZero();
    assertThat(history.capacity()).isEqualTo(RequestHistory.DEFAULT_CAPACITY);
    assertThat(history.entries()).isEmpty();
  }

  @Test
  void listsMostRecentFirst() {
    RequestHistory history = new RequestHistory(3);

    history.add(200, "/a");
    history.add(404, "/b");

    assertThat(history.statusCodes()).containsExactly(404, 200);
    assertThat(history.paths()).containsExactly("/b", "/a");
  }

  @Test
  void dropsOldestWhenFull() {
    RequestHistory history = new RequestHistory(3);

    history.add(200, "/a");
    history.add(201, "/b");
    history.add(202, "/c");
    history.add(203, "/d");
    history.add(204, "/e");

    assertThat(history.size()).isEqualTo(3);
    assertThat(history.paths()).containsExactly("/e", "/d", "/c");
    assertThat(history.statusCodes()).containsExactly(204, 203, 202);
  }

  @Test
  void entriesAreSnapshots() {
    RequestHistory history = new RequestHistory(2);
    history.add(200, "/a");

    List<RequestHistory.Entry> snapshot = history.entries();
    history.add(500, "/b");

    assertThat(snapshot).containsExactly(new RequestHistory.Entry(200, "/a"));
  }

  @Test
  void rejectsNonPositiveCapacity() {
    assertThatThrownBy(() -> new RequestHistory(0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("capacity");
  }
}
