package com.gentoro.flowplan.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowplan.graph.RawEdge;
import com.gentoro.flowplan.plan.PlanNode;
import com.gentoro.flowplan.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Shared case bookkeeping of fork nodes. */
public abstract class ForkNode extends BaseNode implements BranchNode {
  private final Map<String, JsonNode> cases = new LinkedHashMap<>();
  private final Map<String, List<RawEdge>> caseEdges = new LinkedHashMap<>();

  protected ForkNode(JsonNode raw, NodeContext context) {
    super(raw, context);
    for (JsonNode port : JacksonUtility.elements(data, "config__output_ports")) {
      String caseId = JacksonUtility.text(port, "id");
      if (caseId != null) cases.put(caseId, port);
    }
  }

  @Override
  public NodeCategory category() {
    return NodeCategory.FORK;
  }

  /** Plan node with every case empty; control-flow recovery replaces the branches. */
  @Override
  public Optional<PlanNode> toPlanNode() {
    return super.toPlanNode().map(node -> node.setBranches(toBranches(Map.of())));
  }

  @Override
  public List<String> caseIds() {
    return List.copyOf(cases.keySet());
  }

  @Override
  public void bindCase(RawEdge edge) {
    String handle = edge.sourceHandle() == null ? "" : edge.sourceHandle();
    caseEdges.computeIfAbsent(handle, k -> new ArrayList<>()).add(edge);
  }

  @Override
  public Optional<String> caseOf(String targetId) {
    for (Map.Entry<String, List<RawEdge>> entry : caseEdges.entrySet()) {
      for (RawEdge edge : entry.getValue()) {
        if (edge.target().equals(targetId)) return Optional.of(entry.getKey());
      }
    }
    return Optional.empty();
  }

  @Override
  public Optional<JsonNode> caseData(String caseId) {
    return Optional.ofNullable(cases.get(caseId));
  }
}
