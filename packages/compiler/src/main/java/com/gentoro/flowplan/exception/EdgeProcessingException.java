package com.gentoro.flowplan.exception;

import java.util.Map;

/** Wraps any failure raised while ordering the edges of a graph. */
public class EdgeProcessingException extends FlowPlanException {
  public static final String MESSAGE = "Failed to process edges";

  public EdgeProcessingException(Map<String, ?> context) {
    super(FlowPlanErrorCode.EDGE_PROCESSING_ERROR, MESSAGE, context);
  }

  public EdgeProcessingException(Map<String, ?> context, Throwable cause) {
    super(FlowPlanErrorCode.EDGE_PROCESSING_ERROR, MESSAGE, context, cause);
  }
}
