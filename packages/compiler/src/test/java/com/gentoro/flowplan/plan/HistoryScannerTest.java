package com.gentoro.flowplan.plan;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.flowplan.Canvas;
import com.gentoro.flowplan.converter.Converter;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HistoryScannerTest {

  @Test
  @DisplayName("Finds history users at top level and inside branches")
  void topLevelAndBranches() {
    Converter converter = new Converter(Canvas.fixture("branching.json"));
    Plan plan = converter.toPlan("x");

    Set<String> ids = converter.findHistory(plan);

    assertEquals(List.of("x-short", "x-chat"), List.copyOf(ids));
  }

  @Test
  @DisplayName("Descends into sub-canvas plans")
  void subCanvas() {
    Plan plan = new Converter(Canvas.fixture("nested-canvas.json")).toPlan("parent");

    assertEquals(Set.of("child-app-talk"), HistoryScanner.find(plan));
  }

  @Test
  @DisplayName("Nothing flagged, nothing found")
  void none() {
    Plan plan = new Converter(Canvas.linear("a", "b").json()).toPlan("app");

    assertTrue(HistoryScanner.find(plan).isEmpty());
  }
}
