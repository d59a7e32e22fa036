package com.gentoro.flowplan.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowplan.exception.ValidationException;
import com.gentoro.flowplan.plan.PlanNode;
import com.gentoro.flowplan.utility.JacksonUtility;
import com.gentoro.flowplan.utility.StringUtility;
import java.util.Map;

/**
 * Hosted language model. Serialised with kind {@code LLM}; either a fine-tuned job ({@code
 * payload__jobid}) or a named base model.
 */
public class OnlineLlmNode extends BaseNode {
  static final String KIND = "LLM";

  private final boolean useHistory;
  private final String baseModel;
  private final String token;

  public OnlineLlmNode(JsonNode raw, NodeContext context) {
    super(raw, context);
    this.useHistory = flag("payload__use_history");
    String jobId = text("payload__jobid");
    if (!StringUtility.isBlank(jobId)) {
      this.baseModel = jobId;
      this.token = text("payload__token");
    } else {
      this.baseModel = text("payload__base_model");
      this.token = null;
    }
  }

  @Override
  public String kind() {
    return KIND;
  }

  @Override
  protected void describe(PlanNode node) {
    node.putExtra("use_history", useHistory);

    JsonNode control = data.path("payload__model_generate_control");
    node.hyperparameter().set("temperature", numberOr(control, "payload__temperature", 0.8));
    node.hyperparameter().set("top_p", numberOr(control, "payload__top_p", 0.7));
    node.hyperparameter().set("max_new_tokens", numberOr(control, "payload__max_tokens", 4096));

    node.args().set("keys", JacksonUtility.valueToTree(inputNames()));
    node.args().put("type", "online");
    String source = text("payload__source");
    node.args().put("source", source != null ? source : text("payload__model_source"));
    node.args().set("prompt", value("payload__prompt"));
    node.args().put("stream", flag("payload__stream"));
    node.args().put("base_model", baseModel);

    String baseUrl = JacksonUtility.text(data, "payload__base_url", "").trim();
    if (!baseUrl.isEmpty()) node.args().put("base_url", baseUrl);

    JsonNode history = data.get("payload__example_dialogs");
    if (history != null && !history.isNull()) {
      if (!history.isArray() || history.size() % 2 != 0) {
        throw new ValidationException(
            "Example dialogs must alternate user and assistant messages",
            Map.of("nodeId", id()));
      }
      if (history.size() > 0) node.args().set("history", history.deepCopy());
    }
    if (!StringUtility.isBlank(token)) node.args().put("token", token);

    String modelId = text("payload__model_id");
    if (!StringUtility.isBlank(modelId)) {
      context.resolver().modelCredentials(modelId).forEach((k, v) -> node.args().put(k, v));
    }
  }

  private static JsonNode numberOr(JsonNode control, String field, double fallback) {
    JsonNode value = control.get(field);
    if (value != null && !value.isNull()) return value.deepCopy();
    return fallback == Math.rint(fallback)
        ? JacksonUtility.valueToTree((long) fallback)
        : JacksonUtility.valueToTree(fallback);
  }
}
