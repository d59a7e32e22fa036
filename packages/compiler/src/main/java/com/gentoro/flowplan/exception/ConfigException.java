package com.gentoro.flowplan.exception;

/** Configuration could not be loaded or holds an invalid value. */
public class ConfigException extends FlowPlanException {
  public ConfigException(String message) {
    super(FlowPlanErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(FlowPlanErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
