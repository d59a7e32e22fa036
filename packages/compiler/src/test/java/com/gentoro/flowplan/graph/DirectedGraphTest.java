package com.gentoro.flowplan.graph;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DirectedGraphTest {

  @Test
  @DisplayName("Edges come back in insertion order; re-adding only replaces the formatter")
  void insertionOrder() {
    DirectedGraph graph = new DirectedGraph();
    graph.addEdge("a", "c", null);
    graph.addEdge("a", "b", "[0]");
    graph.addEdge("b", "c", "");
    graph.addEdge("a", "c", "x");

    assertEquals(
        List.of(new Edge("a", "c"), new Edge("a", "b"), new Edge("b", "c")), graph.edges());
    assertEquals(List.of("a", "c", "b"), List.copyOf(graph.nodes()));
    assertEquals("x", graph.formatter("a", "c").orElseThrow());
    assertTrue(graph.formatter("b", "c").isEmpty());
    assertTrue(graph.formatter("c", "a").isEmpty());
    assertFalse(graph.hasEdge("c", "a"));
  }

  @Test
  @DisplayName("Simple paths stop at the target and never revisit a node")
  void simplePaths() {
    DirectedGraph graph =
        DirectedGraph.fromEdges(
            List.of(
                new Edge("f", "a"),
                new Edge("f", "b"),
                new Edge("a", "g"),
                new Edge("b", "a"),
                new Edge("g", "h"),
                new Edge("a", "f")));

    assertEquals(
        List.of(List.of("f", "a", "g"), List.of("f", "b", "a", "g")),
        graph.allSimplePaths("f", "g"));
    assertTrue(graph.allSimplePaths("g", "f").isEmpty());
    assertTrue(graph.allSimplePaths("f", "unknown").isEmpty());
  }
}
