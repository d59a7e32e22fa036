package com.gentoro.flowplan.exception;

import java.util.Map;

/** Malformed control flow: bad fork/aggregator regions, cycles or ambiguous boundaries. */
public class GraphStructureException extends FlowPlanException {
  public GraphStructureException(String message) {
    super(FlowPlanErrorCode.INVALID_GRAPH, message);
  }

  public GraphStructureException(String message, Throwable cause) {
    super(FlowPlanErrorCode.INVALID_GRAPH, message, cause);
  }

  public GraphStructureException(String message, Map<String, ?> context) {
    super(FlowPlanErrorCode.INVALID_GRAPH, message, context);
  }
}
