package com.gentoro.flowplan.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowplan.exception.ValidationException;
import com.gentoro.flowplan.utility.JacksonUtility;
import com.gentoro.flowplan.utility.StringUtility;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders loop stop conditions as the Python predicate the engine evaluates after each iteration,
 * e.g. {@code def stop_condition(*x):\n    return x[0] > 3 and x[1] == 'done'}.
 *
 * <p>Each condition compares one loop input, addressed by its slot index, with a literal typed
 * after the slot's declared variable type. Conditions combine left to right; every combination
 * after the first is parenthesised.
 */
final class StopConditionRenderer {
  private static final Set<String> OPERATORS = Set.of(">", "<", "==", "!=", ">=", "<=");

  private StopConditionRenderer() {}

  /** The predicate source, {@code null} when there are no conditions. */
  static String render(List<JsonNode> conditions, List<JsonNode> inputShape) {
    String expr = null;
    boolean compound = false;
    for (JsonNode condition : conditions) {
      String compare = compare(condition, inputShape);
      if (expr == null) {
        expr = compare;
        continue;
      }
      String conjunction = JacksonUtility.text(condition, "conjunction", "and");
      if (!"and".equals(conjunction) && !"or".equals(conjunction)) {
        throw new ValidationException("Unsupported conjunction: " + conjunction);
      }
      expr = (compound ? "(" + expr + ")" : expr) + " " + conjunction + " " + compare;
      compound = true;
    }
    if (expr == null) return null;
    return "def stop_condition(*x):\n    return " + expr;
  }

  private static String compare(JsonNode condition, List<JsonNode> inputShape) {
    String variable = JacksonUtility.text(condition, "variable_name");
    int index = -1;
    String type = null;
    for (int i = 0; i < inputShape.size(); i++) {
      JsonNode slot = inputShape.get(i);
      if (variable != null && variable.equals(JacksonUtility.text(slot, "variable_name"))) {
        index = i;
        type = JacksonUtility.text(slot, "variable_type");
        break;
      }
    }
    if (index < 0) {
      throw new ValidationException(
          "Stop condition references unknown input", Map.of("variable", String.valueOf(variable)));
    }
    String operator = JacksonUtility.text(condition, "operator");
    if (!OPERATORS.contains(operator)) {
      throw new ValidationException("Unsupported operator: " + operator);
    }
    return "x[" + index + "] " + operator + " " + literal(condition.get("value"), type);
  }

  private static String literal(JsonNode value, String type) {
    String text = value == null || value.isNull() ? null : value.asText();
    if (type == null) {
      throw new ValidationException("Stop condition input has no variable type");
    }
    switch (type) {
      case "int" -> {
        Long parsed =
            value != null && value.isIntegralNumber()
                ? Long.valueOf(value.longValue())
                : StringUtility.parseInteger(text);
        if (parsed == null) throw cannotConvert(text, type);
        return Long.toString(parsed);
      }
      case "float" -> {
        Double parsed =
            value != null && value.isNumber()
                ? Double.valueOf(value.doubleValue())
                : StringUtility.parseDecimal(text);
        if (parsed == null) throw cannotConvert(text, type);
        return StringUtility.formatDecimal(parsed);
      }
      case "bool" -> {
        return JacksonUtility.isTruthy(value) ? "True" : "False";
      }
      case "str" -> {
        return StringUtility.quote(text == null ? "None" : text);
      }
      default -> throw new ValidationException("Unsupported variable type: " + type);
    }
  }

  private static ValidationException cannotConvert(String value, String type) {
    return new ValidationException("Cannot convert '" + value + "' to " + type);
  }
}
