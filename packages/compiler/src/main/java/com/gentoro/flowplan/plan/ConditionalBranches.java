package com.gentoro.flowplan.plan;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;

/** Two-way branch of an {@code ifs} node. */
public final class ConditionalBranches implements Branches {
  private final List<PlanNode> whenTrue;
  private final List<PlanNode> whenFalse;

  public ConditionalBranches(List<PlanNode> whenTrue, List<PlanNode> whenFalse) {
    this.whenTrue = List.copyOf(whenTrue);
    this.whenFalse = List.copyOf(whenFalse);
  }

  public List<PlanNode> whenTrue() {
    return whenTrue;
  }

  public List<PlanNode> whenFalse() {
    return whenFalse;
  }

  @Override
  public List<PlanNode> children() {
    List<PlanNode> all = new ArrayList<>(whenTrue);
    all.addAll(whenFalse);
    return all;
  }

  @Override
  public void writeTo(ObjectNode args) {
    args.set("true", toArray(args, whenTrue));
    args.set("false", toArray(args, whenFalse));
  }

  static ArrayNode toArray(ObjectNode owner, List<PlanNode> nodes) {
    ArrayNode array = owner.arrayNode();
    nodes.forEach(n -> array.add(n.toJson()));
    return array;
  }
}
