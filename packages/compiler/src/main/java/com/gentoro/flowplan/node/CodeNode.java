package com.gentoro.flowplan.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowplan.plan.PlanNode;

/** User supplied code block. */
public class CodeNode extends BaseNode {

  public CodeNode(JsonNode raw, NodeContext context) {
    super(raw, context);
  }

  @Override
  protected void describe(PlanNode node) {
    node.args().set("code", value("payload__code"));
  }
}
