package com.gentoro.flowplan.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowplan.plan.PlanNode;
import com.gentoro.flowplan.utility.JacksonUtility;

/**
 * Chat front end resource. {@code history} lists the ids of nodes whose conversation is shown, and
 * is namespaced together with node ids.
 */
public class WebNode extends BaseNode {
  public static final String KIND = "web";

  public WebNode(JsonNode raw, NodeContext context) {
    super(raw, context);
  }

  @Override
  protected void describe(PlanNode node) {
    node.args().set("title", value("payload__title"));
    node.args().set("port", value("payload__port"));
    JsonNode history = data.get("payload__history");
    node.args()
        .set(
            "history",
            history != null && history.isArray()
                ? history.deepCopy()
                : JacksonUtility.createArrayNode());
    node.args().put("audio", flag("payload__audio"));
    node.args().put("kind", KIND);
  }
}
