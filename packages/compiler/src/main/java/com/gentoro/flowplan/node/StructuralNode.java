package com.gentoro.flowplan.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowplan.plan.PlanNode;
import java.util.Optional;

/** Start, end or aggregator node: shapes control flow but has no plan representation. */
public class StructuralNode extends BaseNode {

  public StructuralNode(JsonNode raw, NodeContext context) {
    super(raw, context);
  }

  @Override
  public Optional<PlanNode> toPlanNode() {
    return Optional.empty();
  }

  @Override
  protected void describe(PlanNode node) {}
}
