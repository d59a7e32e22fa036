package com.gentoro.flowplan.plan;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.function.UnaryOperator;

/** Edge of a compiled plan. */
public interface PlanEdge {

  /** Id of the node receiving the value. */
  String oid();

  /** Copy of this edge with every node id passed through {@code rename}. */
  PlanEdge renamed(UnaryOperator<String> rename);

  ObjectNode toJson();
}
