package com.gentoro.flowplan.plan;

import com.gentoro.flowplan.utility.JacksonUtility;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Finds the nodes that need conversation history injected at run time. */
public final class HistoryScanner {
  public static final String USE_HISTORY_EXTRA = "use_history";

  private HistoryScanner() {}

  /** Ids of nodes flagged {@code extras-use_history}, through branches and sub-canvas plans. */
  public static Set<String> find(Plan plan) {
    Set<String> ids = new LinkedHashSet<>();
    scan(plan.nodes(), ids);
    return ids;
  }

  private static void scan(List<PlanNode> nodes, Set<String> ids) {
    for (PlanNode node : nodes) {
      if (node.extra(USE_HISTORY_EXTRA).map(JacksonUtility::isTruthy).orElse(false)) {
        ids.add(node.id());
      }
      scan(node.children(), ids);
      node.subPlan().ifPresent(sub -> scan(sub.nodes(), ids));
    }
  }
}
