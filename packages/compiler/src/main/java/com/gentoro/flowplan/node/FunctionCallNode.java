package com.gentoro.flowplan.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowplan.plan.PlanNode;
import com.gentoro.flowplan.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;

/** Agent loop: a model calling tool resources. */
public class FunctionCallNode extends BaseNode {
  private final String llm;
  private final List<String> tools = new ArrayList<>();

  public FunctionCallNode(JsonNode raw, NodeContext context) {
    super(raw, context);
    this.llm = text("payload__base_model");
    for (JsonNode tool : JacksonUtility.elements(data, "payload__tools")) {
      tools.add(tool.asText());
    }
    useResource("llm", llm);
    useResources("tools", tools);
  }

  @Override
  protected void describe(PlanNode node) {
    node.args().put("llm", llm);
    node.args().set("tools", JacksonUtility.valueToTree(tools));
    node.args().set("algorithm", value("payload__algorithm"));
  }
}
