package com.gentoro.flowplan.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowplan.plan.PlanNode;

/** HTTP server resource that exposes the app. */
public class ServerNode extends BaseNode {
  public static final String KIND = "server";

  public ServerNode(JsonNode raw, NodeContext context) {
    super(raw, context);
  }

  @Override
  protected void describe(PlanNode node) {
    node.args().set("port", value("payload__port"));
    node.args().put("kind", KIND);
  }
}
