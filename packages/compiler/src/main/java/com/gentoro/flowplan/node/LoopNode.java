package com.gentoro.flowplan.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowplan.exception.ValidationException;
import com.gentoro.flowplan.plan.PlanNode;
import com.gentoro.flowplan.utility.JacksonUtility;
import java.util.Map;

/**
 * Sub-canvas executed repeatedly, either a fixed number of times ({@code count}) or until its
 * stop condition holds ({@code while}).
 */
public class LoopNode extends SubgraphNode {
  private final JsonNode stopCondition;

  public LoopNode(JsonNode raw, NodeContext context) {
    super(raw, context);
    this.stopCondition = data.path("payload__stop_condition");
  }

  @Override
  protected void describe(PlanNode node) {
    super.describe(node);
    String type = JacksonUtility.text(stopCondition, "type");
    if ("count".equals(type)) {
      node.args().set("count", stopCondition.path("max_count").deepCopy());
    } else if ("while".equals(type)) {
      node.args()
          .put(
              "stop_condition",
              StopConditionRenderer.render(
                  JacksonUtility.elements(stopCondition, "condition"), inputShape()));
    } else {
      throw new ValidationException(
          "Invalid stop condition type: " + type, Map.of("nodeId", id()));
    }
  }
}
