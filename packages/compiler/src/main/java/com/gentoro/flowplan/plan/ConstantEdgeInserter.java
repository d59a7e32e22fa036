package com.gentoro.flowplan.plan;

import com.gentoro.flowplan.node.ConstantInput;
import java.util.List;
import java.util.Map;

/**
 * Splices literal-valued edges into an edge list.
 *
 * <p>A constant with index 0 goes right before the first edge into its node, index 1 right after
 * it. Larger indexes skip one matching edge per step and apply the same rule further down the list.
 * A constant whose node has no incoming edge, or not enough of them, is dropped.
 */
public final class ConstantEdgeInserter {
  private static final org.slf4j.Logger log =
      com.gentoro.flowplan.logging.LoggingService.getLogger(ConstantEdgeInserter.class);

  public void insert(List<PlanEdge> edges, Map<String, List<ConstantInput>> constants) {
    constants.forEach(
        (nodeId, inputs) -> inputs.forEach(input -> insertOne(edges, nodeId, input)));
  }

  private static void insertOne(List<PlanEdge> edges, String nodeId, ConstantInput input) {
    int remaining = input.index();
    for (int pos = 0; pos < edges.size(); pos++) {
      if (!nodeId.equals(edges.get(pos).oid())) continue;
      if (remaining == 0) {
        edges.add(pos, new ConstantEdge(input.constant(), nodeId));
        return;
      }
      if (remaining == 1) {
        edges.add(pos + 1, new ConstantEdge(input.constant(), nodeId));
        return;
      }
      remaining--;
    }
    log.debug("No edge position for constant input {} of node {}", input.index(), nodeId);
  }
}
