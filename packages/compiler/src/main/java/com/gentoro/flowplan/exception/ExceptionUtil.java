package com.gentoro.flowplan.exception;

import java.util.List;
import java.util.Map;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  /** Context keys that name the canvas node a failure is located on, most specific first. */
  static final List<String> NODE_KEYS = List.of("nodeId", "forkId", "aggregatorId", "id", "node");

  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails}. The outermost {@link
   * FlowPlanException} in the cause chain supplies the code and context; anything else is reported
   * as {@link FlowPlanErrorCode#UNKNOWN}.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    FlowPlanException ex = findCompilerException(t);
    Throwable source = ex == null ? t : ex;
    Map<String, Object> context = ex == null ? Map.of() : ex.getContext();
    return new ErrorDetails(
        source.getClass().getSimpleName(),
        safeMessage(source.getMessage()),
        ex == null ? FlowPlanErrorCode.UNKNOWN : ex.getCode(),
        locateNode(context),
        context,
        rootCause(source));
  }

  private static FlowPlanException findCompilerException(Throwable t) {
    for (Throwable current = t; current != null; current = current.getCause()) {
      if (current instanceof FlowPlanException) return (FlowPlanException) current;
      if (current.getCause() == current) break;
    }
    return null;
  }

  private static String locateNode(Map<String, Object> context) {
    for (String key : NODE_KEYS) {
      Object value = context.get(key);
      if (value != null) return String.valueOf(value);
    }
    return null;
  }

  private static String rootCause(Throwable t) {
    Throwable root = t;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    if (root == t) return null;
    String message = root.getMessage();
    return root.getClass().getSimpleName() + (message == null ? "" : ": " + message);
  }

  /**
   * Single-line summary of the top stack frames, joined in call order with {@code " > "}.
   *
   * @param maxFrames frames to include; {@code <= 0} includes all of them
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }
}
