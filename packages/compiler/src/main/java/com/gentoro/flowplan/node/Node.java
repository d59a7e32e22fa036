package com.gentoro.flowplan.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowplan.graph.Edge;
import com.gentoro.flowplan.plan.PlanNode;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/** A canvas node, wrapped once per compilation by a {@link NodeFactory}. */
public interface Node {

  String id();

  /** Kind as the engine knows it; usually the declared {@code payload__kind}. */
  String kind();

  default String lowerKind() {
    return kind().toLowerCase(Locale.ROOT);
  }

  NodeCategory category();

  /** The raw JSON this node was created from. */
  JsonNode raw();

  /** Declared input port ids, in port order. */
  List<String> inputPorts();

  /** Records that {@code edge} feeds the input port {@code portId}; unknown ports are ignored. */
  void bindInputPort(String portId, Edge edge);

  /** Edges bound to input ports, in port order; unbound ports are skipped. */
  List<Edge> boundInputs();

  List<ConstantInput> constantEdges();

  /** Ids of resources this node references. */
  Set<String> usedResources();

  /** Plan representation, empty for structural nodes. */
  Optional<PlanNode> toPlanNode();
}
