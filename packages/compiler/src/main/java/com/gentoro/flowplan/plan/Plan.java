package com.gentoro.flowplan.plan;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.flowplan.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Executable plan: ordered nodes, edges and resources.
 *
 * <p>The lists are live; compilation stages edit them in place.
 */
public final class Plan {
  private final List<PlanNode> nodes;
  private final List<PlanEdge> edges;
  private final List<PlanNode> resources;
  private final Map<String, String> idMapping = new LinkedHashMap<>();

  public Plan(List<PlanNode> nodes, List<PlanEdge> edges, List<PlanNode> resources) {
    this.nodes = new ArrayList<>(nodes);
    this.edges = new ArrayList<>(edges);
    this.resources = new ArrayList<>(resources);
  }

  public List<PlanNode> nodes() {
    return nodes;
  }

  public List<PlanEdge> edges() {
    return edges;
  }

  public List<PlanNode> resources() {
    return resources;
  }

  /** Canvas id to plan id, filled in when ids are namespaced; empty before that. */
  public Map<String, String> idMapping() {
    return Collections.unmodifiableMap(idMapping);
  }

  void recordIdMapping(Map<String, String> mapping) {
    idMapping.putAll(mapping);
  }

  /** Top-level node or branch descendant with the given current id. */
  public Optional<PlanNode> findNode(String id) {
    for (PlanNode top : nodes) {
      for (PlanNode node : top.selfAndDescendants()) {
        if (node.id().equals(id)) return Optional.of(node);
      }
    }
    return Optional.empty();
  }

  public Optional<PlanNode> findResource(String id) {
    return resources.stream().filter(r -> r.id().equals(id)).findFirst();
  }

  public ObjectNode toJson() {
    ObjectNode json = JacksonUtility.createObjectNode();
    ArrayNode nodeArray = json.putArray("nodes");
    nodes.forEach(n -> nodeArray.add(n.toJson()));
    ArrayNode edgeArray = json.putArray("edges");
    edges.forEach(e -> edgeArray.add(e.toJson()));
    ArrayNode resourceArray = json.putArray("resources");
    resources.forEach(r -> resourceArray.add(r.toJson()));
    return json;
  }

  public String toJsonString() {
    return JacksonUtility.toJson(toJson());
  }

  @Override
  public String toString() {
    return "Plan{nodes=" + nodes.size() + ", edges=" + edges.size() + ", resources="
        + resources.size() + '}';
  }
}
