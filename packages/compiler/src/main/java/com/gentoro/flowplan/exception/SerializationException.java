package com.gentoro.flowplan.exception;

/** Failure reading or writing JSON. */
public class SerializationException extends FlowPlanException {
  public SerializationException(String message) {
    super(FlowPlanErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(FlowPlanErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
