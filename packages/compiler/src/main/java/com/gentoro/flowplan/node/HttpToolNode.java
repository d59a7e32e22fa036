package com.gentoro.flowplan.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.flowplan.plan.PlanNode;
import com.gentoro.flowplan.utility.JacksonUtility;
import com.gentoro.flowplan.utility.StringUtility;

/**
 * HTTP tool resource offered to function-calling models.
 *
 * <p>The tool is published under the deterministic name {@code "Func" + providerId} so that models
 * can address it; the provider id defaults to the node id without dashes. A tool with inline code
 * ({@code payload__code_str}) is emitted in code mode, anything else in API mode with its binding
 * looked up through the {@link ReferenceResolver}.
 */
public class HttpToolNode extends BaseNode {
  public static final String KIND = "httptool";
  public static final String PROVIDER_NAME_EXTRA = "provider_name";

  private final String providerId;

  public HttpToolNode(JsonNode raw, NodeContext context) {
    super(raw, context);
    String configured = text("provider_id");
    this.providerId = configured != null ? configured : id().replace("-", "");
  }

  public String providerName() {
    return "Func" + providerId;
  }

  @Override
  protected void describe(PlanNode node) {
    node.putExtra(PROVIDER_NAME_EXTRA, providerName());
    ObjectNode args = node.args();
    args.set("timeout", value("payload__timeout"));
    args.put("doc", JacksonUtility.text(data, "payload__doc", ""));

    String code = text("payload__code_str");
    if (!StringUtility.isBlank(code)) {
      args.put("code_str", code);
      return;
    }

    ReferenceResolver.ToolBinding binding =
        context
            .resolver()
            .toolBinding(providerId)
            .orElse(new ReferenceResolver.ToolBinding("", "", false));
    args.put("user_id", context.resolver().currentUserId().orElse(null));
    args.put("tool_api_id", binding.toolApiId());
    args.put("authentication_type", binding.authenticationType());
    args.put("share_key", binding.shared());
    args.set("method", value("payload__method"));
    args.set("url", value("payload__url"));

    JsonNode headers = data.get("payload__headers");
    ObjectNode headerCopy =
        headers != null && headers.isObject()
            ? (ObjectNode) headers.deepCopy()
            : JacksonUtility.createObjectNode();
    String apiKey = text("payload__api_key");
    if (!StringUtility.isBlank(apiKey)) headerCopy.put("Authorization", "Bearer " + apiKey);
    args.set("headers", headerCopy);

    JsonNode params = data.get("payload__params");
    args.set("params", params == null ? JacksonUtility.createObjectNode() : params.deepCopy());
    args.set("body", value("payload__body"));

    JsonNode outputs = data.get("payload__outputs");
    if (outputs == null || outputs.isNull()) {
      ArrayNode names = JacksonUtility.createArrayNode();
      for (JsonNode slot : JacksonUtility.elements(data, "config__output_shape")) {
        names.add(JacksonUtility.text(slot, "variable_name"));
      }
      outputs = names.isEmpty() ? null : names;
    }
    boolean extract = false;
    if (outputs != null && outputs.size() == 1) {
      extract = flag("payload__extract_from_result");
    }
    args.set("outputs", outputs == null ? null : outputs.deepCopy());
    if (outputs == null) {
      args.set("extract_from_result", value("payload__extract_from_result"));
    } else {
      args.put("extract_from_result", extract);
    }
    args.set("arg_names", JacksonUtility.valueToTree(inputNames()));
  }
}
