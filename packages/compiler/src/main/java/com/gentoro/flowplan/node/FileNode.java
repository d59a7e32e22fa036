package com.gentoro.flowplan.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowplan.plan.PlanNode;

public class FileNode extends BaseNode {

  public FileNode(JsonNode raw, NodeContext context) {
    super(raw, context);
  }

  @Override
  protected void describe(PlanNode node) {
    node.args().put("id", id());
  }
}
