package com.gentoro.flowplan.plan;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.node.IntNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class IdRewriterTest {

  @Test
  @DisplayName("Sentinels and empty ids keep their value")
  void namespacedSkipsSentinels() {
    assertEquals("app-a", IdRewriter.namespaced("app", "a"));
    assertEquals("__start__", IdRewriter.namespaced("app", "__start__"));
    assertEquals("__end__", IdRewriter.namespaced("app", "__end__"));
    assertEquals("", IdRewriter.namespaced("app", ""));
    assertNull(IdRewriter.namespaced("app", null));
  }

  @Test
  @DisplayName("Nodes, nested branch children and edge endpoints are renamed")
  void rewritesNodesAndEdges() {
    PlanNode leaf = new PlanNode("leaf", "Code");
    PlanNode inner = new PlanNode("inner", "ifs");
    inner.setBranches(new ConditionalBranches(List.of(leaf), List.of()));
    PlanNode outer = new PlanNode("outer", "ifs");
    outer.setBranches(new ConditionalBranches(List.of(inner), List.of()));
    Plan plan =
        new Plan(
            List.of(outer),
            List.of(
                new FlowEdge("__start__", "outer"),
                new ConstantEdge(IntNode.valueOf(3), "outer"),
                new FlowEdge("outer", "__end__", "[0]")),
            List.of());

    Map<String, String> mapping = new IdRewriter().rewrite(plan, "app");

    assertEquals(
        Map.of("outer", "app-outer", "inner", "app-inner", "leaf", "app-leaf"), mapping);
    assertEquals(mapping, plan.idMapping());
    assertEquals("app-leaf", leaf.id());
    assertEquals("leaf", leaf.originalId());
    assertEquals(new FlowEdge("__start__", "app-outer"), plan.edges().get(0));
    assertEquals(new ConstantEdge(IntNode.valueOf(3), "app-outer"), plan.edges().get(1));
    assertEquals(new FlowEdge("app-outer", "__end__", "[0]"), plan.edges().get(2));
  }

  @Test
  @DisplayName("HTTP tool resources are renamed after their provider; ids stay")
  void httpToolResource() {
    PlanNode tool = new PlanNode("tool-1", "httptool");
    tool.putExtra("provider_name", "Functool1");
    Plan plan = new Plan(List.of(), new ArrayList<>(), List.of(tool));

    new IdRewriter().rewrite(plan, "app");

    assertEquals("tool-1", tool.id());
    assertEquals("Functool1", tool.name());
  }
}
