package com.gentoro.flowplan.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowplan.plan.PlanNode;
import com.gentoro.flowplan.utility.StringUtility;

/** Model node backed by a shared model resource, or by a remote job when a job id is set. */
public class SharedLlmNode extends BaseNode {
  private final String jobId;
  private final String model;
  private final String fileResourceId;

  public SharedLlmNode(JsonNode raw, NodeContext context) {
    super(raw, context);
    this.jobId = text("payload__jobid");
    this.fileResourceId = fileResourceId();
    if (!StringUtility.isBlank(jobId)) {
      this.model = jobId;
    } else {
      this.model = text("payload__model");
      useResource("llm", model);
    }
    useResource("file_resource_id", fileResourceId);
  }

  @Override
  protected void describe(PlanNode node) {
    node.args().put("llm", model);
    if (!StringUtility.isBlank(jobId)) {
      node.args().put("local", false);
      node.args().set("token", value("payload__token"));
    }
    node.putExtra("use_history", flag("payload__use_history"));
    if (fileResourceId != null) {
      node.args().put("file_resource_id", fileResourceId);
    }
  }
}
