package com.gentoro.flowplan.plan;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.gentoro.flowplan.node.ConstantInput;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConstantEdgeInserterTest {

  private static List<PlanEdge> edges() {
    return new ArrayList<>(
        List.of(
            new FlowEdge("__start__", "a"),
            new FlowEdge("a", "b"),
            new FlowEdge("c", "b"),
            new FlowEdge("b", "__end__")));
  }

  @Test
  @DisplayName("Index 0 goes before the first edge into the node, index 1 after it")
  void firstTwoSlots() {
    List<PlanEdge> edges = edges();

    new ConstantEdgeInserter()
        .insert(
            edges,
            Map.of(
                "b",
                List.of(
                    new ConstantInput(IntNode.valueOf(1), 0),
                    new ConstantInput(IntNode.valueOf(2), 1))));

    assertEquals(6, edges.size());
    assertEquals(new ConstantEdge(IntNode.valueOf(1), "b"), edges.get(1));
    assertEquals(new FlowEdge("a", "b"), edges.get(2));
    assertEquals(new ConstantEdge(IntNode.valueOf(2), "b"), edges.get(3));
  }

  @Test
  @DisplayName("Higher indexes skip one matching edge per step")
  void laterSlots() {
    List<PlanEdge> edges = edges();

    new ConstantEdgeInserter()
        .insert(edges, Map.of("b", List.of(new ConstantInput(TextNode.valueOf("k"), 2))));

    assertEquals(5, edges.size());
    assertEquals(new FlowEdge("c", "b"), edges.get(2));
    assertEquals(new ConstantEdge(TextNode.valueOf("k"), "b"), edges.get(3));
  }

  @Test
  @DisplayName("No matching edge, no insertion")
  void noTarget() {
    List<PlanEdge> edges = edges();

    new ConstantEdgeInserter()
        .insert(
            edges,
            Map.of(
                "zzz",
                List.of(new ConstantInput(IntNode.valueOf(1), 0)),
                "a",
                List.of(new ConstantInput(IntNode.valueOf(1), 5))));

    assertEquals(edges(), edges);
  }
}
