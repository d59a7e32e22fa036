package com.gentoro.flowplan.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowplan.plan.Branches;
import com.gentoro.flowplan.plan.ConditionalBranches;
import com.gentoro.flowplan.plan.PlanNode;
import com.gentoro.flowplan.utility.JacksonUtility;
import java.util.List;
import java.util.Map;

/** If/else fork. The condition lives on the first output port; cases are {@code true/false}. */
public class IfsNode extends ForkNode {
  static final String TRUE_CASE = "true";
  static final String FALSE_CASE = "false";

  public IfsNode(JsonNode raw, NodeContext context) {
    super(raw, context);
  }

  @Override
  public BranchKind branchKind() {
    return BranchKind.IFS;
  }

  @Override
  public Branches toBranches(Map<String, List<PlanNode>> casePaths) {
    return new ConditionalBranches(
        casePaths.getOrDefault(TRUE_CASE, List.of()),
        casePaths.getOrDefault(FALSE_CASE, List.of()));
  }

  @Override
  protected void describe(PlanNode node) {
    node.args().set("judge_on_full_input", value("payload__judge_on_full_input"));
    List<JsonNode> ports = JacksonUtility.elements(data, "config__output_ports");
    String cond = ports.isEmpty() ? null : JacksonUtility.text(ports.get(0), "cond");
    node.args().put("cond", cond);
  }
}
