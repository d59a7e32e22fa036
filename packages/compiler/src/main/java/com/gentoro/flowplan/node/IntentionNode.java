package com.gentoro.flowplan.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowplan.plan.PlanNode;
import com.gentoro.flowplan.utility.JacksonUtility;

/** Model-driven fork: the base model picks the case whose condition matches the intent. */
public class IntentionNode extends CaseForkNode {
  private final String baseModel;

  public IntentionNode(JsonNode raw, NodeContext context) {
    super(raw, context);
    this.baseModel = text("payload__base_model");
    useResource("base_model", baseModel);
  }

  @Override
  public BranchKind branchKind() {
    return BranchKind.INTENTION;
  }

  @Override
  protected void describe(PlanNode node) {
    node.args().put("base_model", baseModel);
    node.args().put("prompt", JacksonUtility.text(data, "payload__prompt", ""));
    node.args().put("constrain", JacksonUtility.text(data, "payload__constrain", ""));
    node.args().put("attention", JacksonUtility.text(data, "payload__attention", ""));
  }
}
