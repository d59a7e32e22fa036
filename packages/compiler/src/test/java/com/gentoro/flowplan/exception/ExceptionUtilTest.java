package com.gentoro.flowplan.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  void compilerExceptionsKeepCodeAndContext() {
    GraphStructureException ex =
        new GraphStructureException("Graph contains a cycle", Map.of("nodeId", "a"));

    ErrorDetails details = ExceptionUtil.toErrorDetails(ex);

    assertEquals("GraphStructureException", details.type);
    assertEquals(FlowPlanErrorCode.INVALID_GRAPH, details.code);
    assertEquals("a", details.nodeId);
    assertEquals("a", details.context.get("nodeId"));
    assertNull(details.rootCause);
    assertTrue(ex.toString().contains("context={nodeId=a}"));
    assertEquals("INVALID_GRAPH Graph contains a cycle at node a {nodeId=a}", details.toString());
  }

  @Test
  void forkContextLocatesTheFork() {
    ErrorDetails details =
        ExceptionUtil.toErrorDetails(
            new GraphStructureException(
                "Fork must not connect directly to its aggregator",
                Map.of("forkId", "f", "aggregatorId", "g")));

    assertEquals("f", details.nodeId);
    assertEquals("f", details.toJson().get("nodeId").asText());
    assertEquals("g", details.toJson().get("context").get("aggregatorId").asText());
  }

  @Test
  void wrappedCompilerExceptionIsFound() {
    RuntimeException cause = new IllegalArgumentException("boom");
    EdgeProcessingException inner = new EdgeProcessingException(Map.of("endId", "e"), cause);

    ErrorDetails details = ExceptionUtil.toErrorDetails(new IllegalStateException("outer", inner));

    assertEquals("EdgeProcessingException", details.type);
    assertEquals(FlowPlanErrorCode.EDGE_PROCESSING_ERROR, details.code);
    assertNull(details.nodeId);
    assertEquals("IllegalArgumentException: boom", details.rootCause);
    assertEquals("IllegalArgumentException: boom", details.toJson().get("rootCause").asText());
  }

  @Test
  void foreignExceptionsAreUnknown() {
    ErrorDetails details = ExceptionUtil.toErrorDetails(new IllegalStateException());

    assertEquals(FlowPlanErrorCode.UNKNOWN, details.code);
    assertEquals("", details.message);
    assertTrue(details.context.isEmpty());
    assertFalse(details.toJson().has("nodeId"));
  }

  @Test
  void edgeProcessingWrapsCause() {
    RuntimeException cause = new IllegalArgumentException("boom");
    EdgeProcessingException ex = new EdgeProcessingException(Map.of("endId", "e"), cause);

    assertEquals(EdgeProcessingException.MESSAGE, ex.getMessage());
    assertSame(cause, ex.getCause());
    assertEquals(FlowPlanErrorCode.EDGE_PROCESSING_ERROR, ex.getCode());
  }

  @Test
  void compactStackTrace() {
    Exception ex = new Exception("x");

    String trace = ExceptionUtil.formatCompactStackTrace(ex, 2);

    assertTrue(trace.startsWith(ExceptionUtilTest.class.getName() + ".compactStackTrace"));
    assertEquals(1, trace.split(" > ").length - 1);
    assertEquals("", ExceptionUtil.formatCompactStackTrace(null, 3));
  }
}
