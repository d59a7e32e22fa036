package com.gentoro.flowplan.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowplan.plan.PlanNode;

/** Sub-canvas applied to every element of its batched inputs. */
public class WarpNode extends SubgraphNode {

  public WarpNode(JsonNode raw, NodeContext context) {
    super(raw, context);
  }

  @Override
  protected void describe(PlanNode node) {
    super.describe(node);
    node.args().set("batch_flags", value("payload__batch_flags"));
  }
}
