package com.gentoro.flowplan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.flowplan.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/** Builds canvas documents for tests. */
public final class Canvas {
  private final ObjectNode root = JacksonUtility.createObjectNode();
  private final ArrayNode nodes = root.putArray("nodes");
  private final ArrayNode edges = root.putArray("edges");
  private final ArrayNode resources = root.putArray("resources");

  public static Canvas create() {
    return new Canvas();
  }

  /** Canvas JSON from {@code src/test/resources/canvas/<name>}. */
  public static JsonNode fixture(String name) {
    try (InputStream in = Canvas.class.getResourceAsStream("/canvas/" + name)) {
      if (in == null) throw new IllegalArgumentException("missing fixture " + name);
      return JacksonUtility.getJsonMapper().readTree(in);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static ObjectNode node(String id, String kind) {
    ObjectNode node = JacksonUtility.createObjectNode();
    node.put("id", id);
    node.putObject("data").put("payload__kind", kind);
    return node;
  }

  public static ObjectNode data(ObjectNode node) {
    return (ObjectNode) node.get("data");
  }

  /** Output port {@code {id, cond}} appended to a fork node. */
  public static ObjectNode port(ObjectNode node, String id, String cond) {
    ObjectNode port = data(node).withArray("config__output_ports").addObject();
    port.put("id", id);
    if (cond != null) port.put("cond", cond);
    return node;
  }

  public static ObjectNode slot(ObjectNode node, String name, String type) {
    ObjectNode slot = data(node).withArray("config__input_shape").addObject();
    slot.put("variable_name", name);
    slot.put("variable_type", type);
    return slot;
  }

  public Canvas add(ObjectNode node) {
    nodes.add(node);
    return this;
  }

  public Canvas add(String id, String kind) {
    return add(node(id, kind));
  }

  public Canvas resource(ObjectNode resource) {
    resources.add(resource);
    return this;
  }

  public Canvas edge(String source, String target) {
    return edge(source, target, null, null);
  }

  /** Edge leaving a fork through the case port {@code handle}. */
  public Canvas caseEdge(String source, String handle, String target) {
    return edge(source, target, handle, null);
  }

  /** Edge into the input port {@code targetHandle}. */
  public Canvas portEdge(String source, String target, String targetHandle) {
    ObjectNode edge = edges.addObject();
    edge.put("source", source);
    edge.put("target", target);
    edge.put("targetHandle", targetHandle);
    return this;
  }

  public Canvas edge(String source, String target, String sourceHandle, String label) {
    ObjectNode edge = edges.addObject();
    edge.put("source", source);
    edge.put("target", target);
    if (sourceHandle != null) edge.put("sourceHandle", sourceHandle);
    if (label != null) edge.put("label", label);
    return this;
  }

  /** {@code start -> ids... -> end}, adding code nodes for every id. */
  public static Canvas linear(String... ids) {
    Canvas canvas = create().add("start", "Start").add("end", "End");
    String previous = "start";
    for (String id : ids) {
      canvas.add(code(id, "return " + id));
      canvas.edge(previous, id);
      previous = id;
    }
    return canvas.edge(previous, "end");
  }

  public static ObjectNode code(String id, String source) {
    ObjectNode node = node(id, "Code");
    data(node).put("payload__code", source);
    return node;
  }

  public ObjectNode json() {
    return root;
  }
}
