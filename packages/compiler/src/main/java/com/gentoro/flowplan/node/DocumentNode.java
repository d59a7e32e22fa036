package com.gentoro.flowplan.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.flowplan.plan.PlanNode;
import com.gentoro.flowplan.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;

/** Document collection resource; node groups may reference a parsing model. */
public class DocumentNode extends BaseNode {
  private final String embed;
  private final ArrayNode nodeGroups;

  public DocumentNode(JsonNode raw, NodeContext context) {
    super(raw, context);
    this.embed = text("payload__embed");
    useResource("embed", embed);

    this.nodeGroups = JacksonUtility.createArrayNode();
    List<String> models = new ArrayList<>();
    for (JsonNode group : JacksonUtility.elements(data, "payload__node_group")) {
      if (!group.isObject()) {
        nodeGroups.add(group.deepCopy());
        continue;
      }
      ObjectNode copy = (ObjectNode) group.deepCopy();
      if (copy.has("key")) {
        copy.set("name", copy.remove("key"));
      }
      String llm = JacksonUtility.text(copy, "llm");
      if (llm != null) models.add(llm);
      nodeGroups.add(copy);
    }
    useResources("llm", models);
  }

  @Override
  protected void describe(PlanNode node) {
    JsonNode path = data.get("payload__dataset_path");
    // only the first dataset path is used
    if (path != null && path.isArray() && path.size() > 0) path = path.get(0);
    node.args().set("dataset_path", path == null ? null : path.deepCopy());
    node.args().put("embed", embed);
    node.args().set("create_ui", value("payload__create_ui"));
    node.args().set("node_group", nodeGroups.deepCopy());
  }
}
