package com.gentoro.flowplan.node;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowplan.exception.ValidationException;
import com.gentoro.flowplan.utility.JacksonUtility;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StopConditionRendererTest {

  private static List<JsonNode> json(String array) {
    return JacksonUtility.elements(JacksonUtility.readTree("{\"a\":" + array + "}"), "a");
  }

  private static final List<JsonNode> SHAPE =
      json(
          "[{\"variable_name\":\"n\",\"variable_type\":\"int\"},"
              + "{\"variable_name\":\"s\",\"variable_type\":\"str\"},"
              + "{\"variable_name\":\"f\",\"variable_type\":\"float\"}]");

  @Test
  @DisplayName("Conditions combine left to right with literals typed by slot")
  void combined() {
    String rendered =
        StopConditionRenderer.render(
            json(
                "[{\"variable_name\":\"n\",\"operator\":\">\",\"value\":\"3\"},"
                    + "{\"variable_name\":\"s\",\"operator\":\"==\",\"value\":\"done\","
                    + "\"conjunction\":\"and\"},"
                    + "{\"variable_name\":\"f\",\"operator\":\"<=\",\"value\":2,"
                    + "\"conjunction\":\"or\"}]"),
            SHAPE);

    assertEquals(
        "def stop_condition(*x):\n    return (x[0] > 3 and x[1] == 'done') or x[2] <= 2.0",
        rendered);
  }

  @Test
  @DisplayName("No conditions, no predicate")
  void empty() {
    assertNull(StopConditionRenderer.render(List.of(), SHAPE));
  }

  @Test
  @DisplayName("Bad operators, unknown inputs and unconvertible values are rejected")
  void invalid() {
    assertThrows(
        ValidationException.class,
        () ->
            StopConditionRenderer.render(
                json("[{\"variable_name\":\"n\",\"operator\":\"=~\",\"value\":1}]"), SHAPE));
    assertThrows(
        ValidationException.class,
        () ->
            StopConditionRenderer.render(
                json("[{\"variable_name\":\"zz\",\"operator\":\">\",\"value\":1}]"), SHAPE));
    assertThrows(
        ValidationException.class,
        () ->
            StopConditionRenderer.render(
                json("[{\"variable_name\":\"n\",\"operator\":\">\",\"value\":\"abc\"}]"), SHAPE));
  }
}
