package com.gentoro.flowplan.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowplan.plan.Branches;
import com.gentoro.flowplan.plan.CaseBranches;
import com.gentoro.flowplan.plan.PlanNode;
import com.gentoro.flowplan.utility.JacksonUtility;
import com.gentoro.flowplan.utility.StringUtility;
import java.util.List;
import java.util.Map;

/**
 * Fork whose cases are keyed by the {@code cond} of their output port.
 *
 * <p>An empty condition means {@code default}. When the first input slot is typed {@code int} or
 * {@code float}, keys are converted to numbers; values that do not parse stay strings.
 */
public abstract class CaseForkNode extends ForkNode {

  protected CaseForkNode(JsonNode raw, NodeContext context) {
    super(raw, context);
  }

  /** Key under which the case appears in {@code args.nodes}. */
  public Object caseKey(String caseId) {
    String cond =
        caseData(caseId).map(port -> JacksonUtility.text(port, "cond")).orElse(null);
    if (StringUtility.isBlank(cond)) return CaseBranches.DEFAULT_KEY;
    if (CaseBranches.DEFAULT_KEY.equals(cond)) return cond;

    List<JsonNode> shape = inputShape();
    String type = shape.isEmpty() ? null : JacksonUtility.text(shape.get(0), "variable_type");
    if ("int".equals(type)) {
      Long parsed = StringUtility.parseInteger(cond);
      return parsed == null ? cond : parsed;
    }
    if ("float".equals(type)) {
      Double parsed = StringUtility.parseDecimal(cond);
      return parsed == null ? cond : parsed;
    }
    return cond;
  }

  @Override
  public Branches toBranches(Map<String, List<PlanNode>> casePaths) {
    CaseBranches branches = new CaseBranches();
    for (String caseId : caseIds()) {
      branches.put(caseKey(caseId), casePaths.getOrDefault(caseId, List.of()));
    }
    return branches;
  }
}
