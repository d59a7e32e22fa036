package com.gentoro.flowplan.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception for the plan compiler with a stable {@link FlowPlanErrorCode} and optional
 * context.
 *
 * <p>The context map is copied on construction and exposed read-only, so callers can attach the
 * offending node or edge ids without worrying about later mutation.
 */
public class FlowPlanException extends RuntimeException {
  private final FlowPlanErrorCode code;
  private final Map<String, Object> context;

  public FlowPlanException(FlowPlanErrorCode code, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
    this.context = Collections.emptyMap();
  }

  public FlowPlanException(FlowPlanErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = Collections.emptyMap();
  }

  public FlowPlanException(FlowPlanErrorCode code, String message, Map<String, ?> context) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public FlowPlanException(
      FlowPlanErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public FlowPlanErrorCode getCode() {
    return code;
  }

  /** Node ids, edge endpoints and similar details that locate the failure in the graph. */
  public Map<String, Object> getContext() {
    return context;
  }

  private static Map<String, Object> copy(Map<String, ?> input) {
    if (input == null || input.isEmpty()) return Collections.emptyMap();
    Map<String, Object> m = new LinkedHashMap<>();
    input.forEach(m::put);
    return Collections.unmodifiableMap(m);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName()
        + "{"
        + "code="
        + code
        + ", message="
        + getMessage()
        + (context.isEmpty() ? "" : ", context=" + context)
        + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
        + '}';
  }
}
