package com.gentoro.flowplan.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowplan.plan.PlanNode;
import com.gentoro.flowplan.utility.StringUtility;

/** Retrieval over a document resource. */
public class RetrieverNode extends BaseNode {
  private final String doc;

  public RetrieverNode(JsonNode raw, NodeContext context) {
    super(raw, context);
    this.doc = text("payload__doc");
    useResource("doc", doc);
  }

  @Override
  protected void describe(PlanNode node) {
    node.args().put("doc", doc);
    node.args().set("group_name", value("payload__group_name"));
    node.args().set("similarity", value("payload__similarity"));
    node.args().set("topk", value("payload__topk"));
    node.args().put("target", blankToNull(text("payload__target")));
    node.args().put("output_format", blankToNull(text("payload__output_format")));
    node.args().put("join", flag("payload__join"));
  }

  private static String blankToNull(String value) {
    return StringUtility.isBlank(value) ? null : value;
  }
}
