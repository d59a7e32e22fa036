package com.gentoro.flowplan.exception;

import java.util.Map;

/** Node or fork kind the compiler does not know how to lower. */
public class UnsupportedFeatureException extends FlowPlanException {
  public UnsupportedFeatureException(String message) {
    super(FlowPlanErrorCode.UNSUPPORTED_FEATURE, message);
  }

  public UnsupportedFeatureException(String message, Throwable cause) {
    super(FlowPlanErrorCode.UNSUPPORTED_FEATURE, message, cause);
  }

  public UnsupportedFeatureException(String message, Map<String, ?> context) {
    super(FlowPlanErrorCode.UNSUPPORTED_FEATURE, message, context);
  }
}
