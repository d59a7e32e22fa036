package com.gentoro.flowplan.exception;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.flowplan.utility.JacksonUtility;
import java.util.Map;

/**
 * Structured description of a failed compilation, for logs and for callers that report canvas
 * errors back to an editor. {@code nodeId} points at the canvas node the failure was located on,
 * when the exception carried one.
 */
public final class ErrorDetails {
  public final String type;
  public final String message;
  public final FlowPlanErrorCode code;
  public final String nodeId;
  public final Map<String, Object> context;
  public final String rootCause;

  public ErrorDetails(
      String type,
      String message,
      FlowPlanErrorCode code,
      String nodeId,
      Map<String, Object> context,
      String rootCause) {
    this.type = type;
    this.message = message;
    this.code = code;
    this.nodeId = nodeId;
    this.context = context == null ? Map.of() : context;
    this.rootCause = rootCause;
  }

  public ObjectNode toJson() {
    ObjectNode json = JacksonUtility.createObjectNode();
    json.put("code", code.name());
    json.put("type", type);
    json.put("message", message);
    if (nodeId != null) json.put("nodeId", nodeId);
    if (!context.isEmpty()) json.set("context", JacksonUtility.valueToTree(context));
    if (rootCause != null) json.put("rootCause", rootCause);
    return json;
  }

  @Override
  public String toString() {
    return code
        + " "
        + message
        + (nodeId == null ? "" : " at node " + nodeId)
        + (context.isEmpty() ? "" : " " + context)
        + (rootCause == null ? "" : " caused by " + rootCause);
  }
}
