package com.gentoro.flowplan.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowplan.plan.Branches;
import com.gentoro.flowplan.plan.CaseBranches;
import com.gentoro.flowplan.plan.PlanNode;
import java.util.List;
import java.util.Map;

public class SwitchNode extends CaseForkNode {

  public SwitchNode(JsonNode raw, NodeContext context) {
    super(raw, context);
  }

  @Override
  public BranchKind branchKind() {
    return BranchKind.SWITCH;
  }

  @Override
  public Branches toBranches(Map<String, List<PlanNode>> casePaths) {
    return ((CaseBranches) super.toBranches(casePaths)).defaultLast();
  }

  @Override
  protected void describe(PlanNode node) {
    node.args().set("judge_on_full_input", value("payload__judge_on_full_input"));
  }
}
