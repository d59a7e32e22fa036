package com.gentoro.flowplan.node;

import static com.gentoro.flowplan.Canvas.data;
import static com.gentoro.flowplan.Canvas.node;
import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.flowplan.Canvas;
import com.gentoro.flowplan.exception.UnsupportedFeatureException;
import com.gentoro.flowplan.exception.ValidationException;
import com.gentoro.flowplan.plan.PlanNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DefaultNodeFactoryTest {

  private final DefaultNodeFactory factory = new DefaultNodeFactory();

  @Test
  @DisplayName("Kinds resolve case-insensitively to their categories")
  void categories() {
    assertEquals(NodeCategory.START, factory.create(node("s", "Start")).category());
    assertEquals(NodeCategory.END, factory.create(node("e", "answer")).category());
    assertEquals(NodeCategory.AGGREGATOR, factory.create(node("g", "Aggregator")).category());
    assertEquals(NodeCategory.FORK, factory.create(node("f", "IFS")).category());
    assertEquals(NodeCategory.STANDARD, factory.create(node("c", "code")).category());
    assertTrue(factory.create(node("s", "start")).toPlanNode().isEmpty());
  }

  @Test
  @DisplayName("The legacy type field is read when payload__kind is absent")
  void legacyTypeField() {
    ObjectNode raw = node("c", "ignored");
    data(raw).remove("payload__kind");
    data(raw).put("type", "Code");

    assertInstanceOf(CodeNode.class, factory.create(raw));
  }

  @Test
  @DisplayName("Unknown kinds and missing ids are rejected")
  void rejects() {
    UnsupportedFeatureException unknown =
        assertThrows(UnsupportedFeatureException.class, () -> factory.create(node("x", "Nope")));
    assertEquals("Nope", unknown.getContext().get("kind"));

    ObjectNode noId = node("", "Code");
    assertThrows(ValidationException.class, () -> factory.create(noId));
  }

  @Test
  @DisplayName("Registered kinds take part in compilation")
  void customKind() {
    factory.register(
        "Echo",
        (raw, context) ->
            new BaseNode(raw, context) {
              @Override
              protected void describe(PlanNode node) {
                node.args().put("echo", true);
              }
            });

    PlanNode node = factory.create(node("e", "echo")).toPlanNode().orElseThrow();

    assertTrue(node.args().get("echo").booleanValue());
    assertFalse(node.extra("enable_backflow").orElseThrow().booleanValue());
  }

  @Test
  @DisplayName("Loop nodes render count and while stop conditions")
  void loopNodes() {
    ObjectNode count = node("loop", "loop");
    data(count).set("config__patent_graph", Canvas.linear("a").json());
    data(count).putObject("payload__stop_condition").put("type", "count").put("max_count", 3);

    PlanNode counted = factory.create(count).toPlanNode().orElseThrow();
    assertEquals(3, counted.args().get("count").intValue());

    ObjectNode bad = count.deepCopy();
    ((ObjectNode) data(bad).get("payload__stop_condition")).put("type", "forever");
    assertThrows(ValidationException.class, () -> factory.create(bad).toPlanNode());
  }
}
