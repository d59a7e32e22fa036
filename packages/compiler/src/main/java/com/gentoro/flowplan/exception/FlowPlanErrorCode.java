package com.gentoro.flowplan.exception;

/**
 * Canonical error codes raised while compiling a workflow graph. Codes are stable and safe to
 * surface to callers of the compiler.
 */
public enum FlowPlanErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  NOT_FOUND,

  // I/O and configuration
  CONFIGURATION_ERROR,
  SERIALIZATION_ERROR,

  // Compilation
  INVALID_GRAPH,
  EDGE_PROCESSING_ERROR,
  UNSUPPORTED_FEATURE,
}
