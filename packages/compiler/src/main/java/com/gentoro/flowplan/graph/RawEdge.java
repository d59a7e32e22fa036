package com.gentoro.flowplan.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowplan.exception.ValidationException;
import com.gentoro.flowplan.utility.JacksonUtility;
import java.util.Map;

/**
 * Edge as drawn on the canvas.
 *
 * @param sourceHandle output port of the source; on fork nodes this names the case
 * @param targetHandle input port of the target
 * @param label formatter applied to the value travelling on the edge, empty when absent
 */
public record RawEdge(
    String source, String target, String sourceHandle, String targetHandle, String label) {

  public static RawEdge fromJson(JsonNode json) {
    String source = JacksonUtility.text(json, "source");
    String target = JacksonUtility.text(json, "target");
    if (source == null || target == null) {
      throw new ValidationException(
          "Edge is missing its source or target", Map.of("edge", String.valueOf(json)));
    }
    return new RawEdge(
        source,
        target,
        JacksonUtility.text(json, "sourceHandle"),
        JacksonUtility.text(json, "targetHandle"),
        JacksonUtility.text(json, "label", ""));
  }

  /** Canvas helper edges connect a node to its own {@code <id>_link} anchor. */
  public boolean isLinkAnchor() {
    return target.equals(source + "_link");
  }

  public Edge edge() {
    return new Edge(source, target);
  }
}
