package com.gentoro.flowplan.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.flowplan.converter.ConverterSettings;
import com.gentoro.flowplan.exception.GraphStructureException;
import com.gentoro.flowplan.exception.NotFoundException;
import com.gentoro.flowplan.exception.UnsupportedFeatureException;
import com.gentoro.flowplan.node.BranchNode;
import com.gentoro.flowplan.node.ConstantInput;
import com.gentoro.flowplan.node.Node;
import com.gentoro.flowplan.node.NodeFactory;
import com.gentoro.flowplan.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lookup tables over one canvas: nodes and resources by id, role buckets, case bindings of fork
 * nodes, input port order and constant inputs.
 *
 * <p>Resources are registered before nodes, so a node sharing its id with a resource shadows it.
 */
public final class GraphIndex {
  private static final org.slf4j.Logger log =
      com.gentoro.flowplan.logging.LoggingService.getLogger(GraphIndex.class);

  public static final String START_SENTINEL = "__start__";
  public static final String END_SENTINEL = "__end__";

  private final RawGraph graph;
  private final ConverterSettings settings;
  private final Map<String, Node> byId = new LinkedHashMap<>();
  private final List<Node> resources = new ArrayList<>();
  private final List<Node> nodes = new ArrayList<>();
  private final Set<String> forkIds = new LinkedHashSet<>();
  private final Set<String> aggregatorIds = new LinkedHashSet<>();
  private final Map<String, List<ConstantInput>> constantEdges = new LinkedHashMap<>();
  private final Map<String, List<Edge>> targetSortingInputs = new LinkedHashMap<>();
  private String startId;
  private String endId;

  private GraphIndex(RawGraph graph, ConverterSettings settings) {
    this.graph = graph;
    this.settings = settings;
  }

  public static GraphIndex build(RawGraph graph, NodeFactory factory, ConverterSettings settings) {
    GraphIndex index = new GraphIndex(graph, settings);
    index.register(factory);
    index.bindEdges();
    log.debug(
        "Indexed {} nodes, {} resources, {} edges (start={}, end={}, forks={}, aggregators={})",
        index.nodes.size(),
        index.resources.size(),
        graph.edges().size(),
        index.startId,
        index.endId,
        index.forkIds,
        index.aggregatorIds);
    return index;
  }

  private void register(NodeFactory factory) {
    for (JsonNode raw : graph.resources()) {
      Node resource = factory.create(raw);
      resources.add(resource);
      byId.put(resource.id(), resource);
    }
    for (JsonNode raw : graph.nodes()) {
      addNode(factory.create(raw));
    }
    if (startId == null && referencedByEdges(START_SENTINEL)) {
      addNode(factory.create(sentinel(START_SENTINEL)));
    }
    if (endId == null && referencedByEdges(END_SENTINEL)) {
      addNode(factory.create(sentinel(END_SENTINEL)));
    }
  }

  private void addNode(Node node) {
    nodes.add(node);
    byId.put(node.id(), node);
    switch (node.category()) {
      case FORK -> forkIds.add(node.id());
      case START -> startId = boundary("start", startId, node.id());
      case AGGREGATOR -> aggregatorIds.add(node.id());
      case END -> endId = boundary("end", endId, node.id());
      default -> {}
    }
    if (!node.constantEdges().isEmpty()) {
      constantEdges.put(node.id(), node.constantEdges());
    }
  }

  private String boundary(String role, String current, String candidate) {
    if (current == null || current.equals(candidate)) return candidate;
    if (settings.strictBoundaries()) {
      throw new GraphStructureException(
          "Graph declares more than one " + role + " node",
          Map.of("first", current, "second", candidate));
    }
    log.warn("Graph declares more than one {} node; {} replaces {}", role, candidate, current);
    return candidate;
  }

  private boolean referencedByEdges(String id) {
    return graph.edges().stream().anyMatch(e -> e.source().equals(id) || e.target().equals(id));
  }

  private static JsonNode sentinel(String id) {
    ObjectNode raw = JacksonUtility.createObjectNode();
    raw.put("id", id);
    raw.putObject("data").put("payload__kind", id);
    return raw;
  }

  private void bindEdges() {
    for (RawEdge edge : graph.edges()) {
      Node source = node(edge.source());
      Node target = node(edge.target());
      if (forkIds.contains(source.id())) {
        if (!(source instanceof BranchNode fork)) {
          throw new UnsupportedFeatureException(
              "Fork kind has no branch support: " + source.kind(), Map.of("nodeId", source.id()));
        }
        fork.bindCase(edge);
      }
      if (target.inputPorts().size() > 1) {
        target.bindInputPort(edge.targetHandle(), edge.edge());
      }
    }
    for (Node node : nodes) {
      if (node.inputPorts().size() > 1) {
        targetSortingInputs.put(node.id(), node.boundInputs());
      }
    }
  }

  /** Node or resource by id. */
  public Node node(String id) {
    Node node = id == null ? null : byId.get(id);
    if (node == null) {
      throw new NotFoundException("node not found: " + id, Map.of("id", String.valueOf(id)));
    }
    return node;
  }

  public Optional<Node> find(String id) {
    return Optional.ofNullable(id == null ? null : byId.get(id));
  }

  public RawGraph graph() {
    return graph;
  }

  public List<Node> nodes() {
    return Collections.unmodifiableList(nodes);
  }

  public List<Node> resources() {
    return Collections.unmodifiableList(resources);
  }

  public Optional<String> startId() {
    return Optional.ofNullable(startId);
  }

  public Optional<String> endId() {
    return Optional.ofNullable(endId);
  }

  public Set<String> forkIds() {
    return Collections.unmodifiableSet(forkIds);
  }

  public Set<String> aggregatorIds() {
    return Collections.unmodifiableSet(aggregatorIds);
  }

  public boolean isFork(String id) {
    return forkIds.contains(id);
  }

  public boolean isAggregator(String id) {
    return aggregatorIds.contains(id);
  }

  /** Constant inputs per node id, in node order. */
  public Map<String, List<ConstantInput>> constantEdges() {
    return Collections.unmodifiableMap(constantEdges);
  }

  /**
   * For nodes with more than one input port: the edges bound to those ports, in port order.
   * Callers that rewrite entries must work on a copy.
   */
  public Map<String, List<Edge>> targetSortingInputs() {
    return Collections.unmodifiableMap(targetSortingInputs);
  }
}
