package com.gentoro.flowplan.plan;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/** Child node lists owned by a fork node, one list per case. */
public interface Branches {

  /** Every child node, case by case in declared order. */
  List<PlanNode> children();

  /** Writes the branch lists into the fork's serialised {@code args}. */
  void writeTo(ObjectNode args);
}
