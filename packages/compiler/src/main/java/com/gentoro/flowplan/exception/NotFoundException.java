package com.gentoro.flowplan.exception;

import java.util.Map;

/** A node or resource id that the graph does not declare. */
public class NotFoundException extends FlowPlanException {
  public NotFoundException(String message) {
    super(FlowPlanErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(FlowPlanErrorCode.NOT_FOUND, message, cause);
  }

  public NotFoundException(String message, Map<String, ?> context) {
    super(FlowPlanErrorCode.NOT_FOUND, message, context);
  }
}
