package com.gentoro.flowplan.exception;

import java.util.Map;

/** Input validation failure or illegal argument. */
public class ValidationException extends FlowPlanException {
  public ValidationException(String message) {
    super(FlowPlanErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(FlowPlanErrorCode.INVALID_ARGUMENT, message, cause);
  }

  public ValidationException(String message, Map<String, ?> context) {
    super(FlowPlanErrorCode.INVALID_ARGUMENT, message, context);
  }
}
