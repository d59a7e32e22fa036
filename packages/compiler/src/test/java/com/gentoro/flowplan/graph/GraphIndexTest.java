package com.gentoro.flowplan.graph;

import static com.gentoro.flowplan.Canvas.code;
import static com.gentoro.flowplan.Canvas.data;
import static com.gentoro.flowplan.Canvas.node;
import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.flowplan.Canvas;
import com.gentoro.flowplan.converter.ConverterSettings;
import com.gentoro.flowplan.exception.GraphStructureException;
import com.gentoro.flowplan.exception.ValidationException;
import com.gentoro.flowplan.node.DefaultNodeFactory;
import com.gentoro.flowplan.utility.JacksonUtility;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GraphIndexTest {

  private static GraphIndex index(Canvas canvas, ConverterSettings settings) {
    return GraphIndex.build(RawGraph.fromJson(canvas.json()), new DefaultNodeFactory(), settings);
  }

  @Test
  @DisplayName("Sentinel ids referenced by edges become implicit start and end nodes")
  void implicitSentinels() {
    Canvas canvas =
        Canvas.create().add(code("a", "a")).edge("__start__", "a").edge("a", "__end__");

    GraphIndex index = index(canvas, ConverterSettings.defaults());

    assertEquals("__start__", index.startId().orElseThrow());
    assertEquals("__end__", index.endId().orElseThrow());
    assertEquals(3, index.nodes().size());
  }

  @Test
  @DisplayName("Without strict boundaries the last end node wins")
  void lenientBoundaries() {
    Canvas canvas = Canvas.linear("a").add("end2", "End").edge("a", "end2");

    GraphIndex index = index(canvas, new ConverterSettings(64, false, List.of()));

    assertEquals("end2", index.endId().orElseThrow());
  }

  @Test
  @DisplayName("Strict boundaries reject a second start node")
  void strictBoundaries() {
    Canvas canvas = Canvas.linear("a").add("start2", "Start");

    GraphStructureException ex =
        assertThrows(
            GraphStructureException.class, () -> index(canvas, ConverterSettings.defaults()));
    assertEquals("start", ex.getContext().get("first"));
    assertEquals("start2", ex.getContext().get("second"));
  }

  @Test
  @DisplayName("Multi-port targets record their inputs in port order")
  void portOrder() {
    ObjectNode join = code("join", "j");
    ArrayNode ports = data(join).putArray("config__input_ports");
    ports.addObject().put("id", "p1");
    ports.addObject().put("id", "p2");
    Canvas canvas =
        Canvas.create()
            .add(code("a", "a"))
            .add(code("b", "b"))
            .add(join)
            .portEdge("b", "join", "p2")
            .portEdge("a", "join", "p1");

    GraphIndex index = index(canvas, ConverterSettings.defaults());

    assertEquals(
        List.of(new Edge("a", "join"), new Edge("b", "join")),
        index.targetSortingInputs().get("join"));
  }

  @Test
  @DisplayName("Roles, resources and link anchors are indexed")
  void roles() {
    Canvas canvas =
        Canvas.linear("a")
            .add(node("f", "switch"))
            .add("g", "aggregator")
            .resource(node("srv", "server"))
            .edge("a", "a_link");

    GraphIndex index = index(canvas, ConverterSettings.defaults());

    assertEquals(Set.of("f"), index.forkIds());
    assertTrue(index.isAggregator("g"));
    assertEquals("srv", index.resources().get(0).id());
    assertEquals(2, index.graph().edges().size());
  }

  @Test
  @DisplayName("Non-object documents are invalid")
  void notAnObject() {
    assertThrows(
        ValidationException.class,
        () -> RawGraph.fromJson(JacksonUtility.createArrayNode()));
  }
}
