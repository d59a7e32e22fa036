package com.gentoro.flowplan.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowplan.converter.Converter;
import com.gentoro.flowplan.exception.NotFoundException;
import com.gentoro.flowplan.plan.PlanNode;
import com.gentoro.flowplan.utility.JacksonUtility;
import java.util.Locale;
import java.util.Map;

/**
 * Node that embeds another canvas. The embedded graph is compiled with its own app id, and its
 * plan becomes this node's {@code args}.
 *
 * <p>{@code template} canvases are editable copies of an app and are emitted as {@code SubGraph}.
 */
public class SubgraphNode extends BaseNode {
  public static final String PATENT_DATA_EXTRA = "config__patent_data";
  static final String TEMPLATE_KIND = "template";
  static final String SUBGRAPH_KIND = "SubGraph";

  private final String appId;
  private final JsonNode graph;
  private final JsonNode overrides;

  public SubgraphNode(JsonNode raw, NodeContext context) {
    super(raw, context);
    this.appId = text("payload__patent_id");
    JsonNode embedded = data.get("config__patent_graph");
    if (embedded == null || embedded.isNull() || embedded.isEmpty()) {
      embedded =
          context
              .resolver()
              .subgraph(appId)
              .orElseThrow(
                  () ->
                      new NotFoundException(
                          "sub-canvas graph not found",
                          Map.of("nodeId", id(), "appId", String.valueOf(appId))));
    }
    this.graph = embedded;
    JsonNode patentData = data.get(PATENT_DATA_EXTRA);
    this.overrides =
        patentData == null || patentData.isNull() ? JacksonUtility.createObjectNode() : patentData;
  }

  @Override
  protected void describe(PlanNode node) {
    node.putExtra(PATENT_DATA_EXTRA, overrides.deepCopy());
    node.setSubPlan(new Converter(graph, context.factory(), context.settings()).toPlan(appId));
    if (TEMPLATE_KIND.equals(kind().toLowerCase(Locale.ROOT))) {
      node.setKind(SUBGRAPH_KIND);
    }
  }
}
