package com.gentoro.flowplan.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowplan.exception.ValidationException;
import com.gentoro.flowplan.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Canvas document: {@code {nodes, resources, edges}}, optionally wrapped as {@code {graph: {...}}}.
 * Link anchor edges are dropped on load.
 */
public record RawGraph(List<JsonNode> nodes, List<JsonNode> resources, List<RawEdge> edges) {

  public RawGraph {
    nodes = List.copyOf(nodes);
    resources = List.copyOf(resources);
    edges = List.copyOf(edges);
  }

  public static RawGraph fromJson(JsonNode json) {
    if (json == null || !json.isObject()) {
      throw new ValidationException(
          "Graph document must be a JSON object", Map.of("document", String.valueOf(json)));
    }
    JsonNode graph = json.has("graph") && json.get("graph").isObject() ? json.get("graph") : json;
    List<RawEdge> edges = new ArrayList<>();
    for (JsonNode edge : JacksonUtility.elements(graph, "edges")) {
      RawEdge parsed = RawEdge.fromJson(edge);
      if (!parsed.isLinkAnchor()) edges.add(parsed);
    }
    return new RawGraph(
        JacksonUtility.elements(graph, "nodes"),
        JacksonUtility.elements(graph, "resources"),
        edges);
  }
}
