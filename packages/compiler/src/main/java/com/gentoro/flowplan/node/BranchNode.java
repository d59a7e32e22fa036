package com.gentoro.flowplan.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowplan.graph.RawEdge;
import com.gentoro.flowplan.plan.Branches;
import com.gentoro.flowplan.plan.PlanNode;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Fork node: routes its input into exactly one of several cases. */
public interface BranchNode extends Node {

  BranchKind branchKind();

  /** Declared case ids (output ports), in declared order. */
  List<String> caseIds();

  /** Attaches an outgoing edge to the case named by its {@code sourceHandle}. */
  void bindCase(RawEdge edge);

  /** Case whose outgoing edge leads to {@code targetId}. */
  Optional<String> caseOf(String targetId);

  /** Output port configuration of a case. */
  Optional<JsonNode> caseData(String caseId);

  /** Case lists laid out for this fork kind, from case id to plan nodes. */
  Branches toBranches(Map<String, List<PlanNode>> casePaths);
}
