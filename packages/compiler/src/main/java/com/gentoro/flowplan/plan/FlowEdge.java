package com.gentoro.flowplan.plan;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.flowplan.utility.JacksonUtility;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Value flow from {@code iid} to {@code oid}.
 *
 * @param formatter optional transformation applied on the way, {@code null} when absent
 */
public record FlowEdge(String iid, String oid, String formatter) implements PlanEdge {
  public FlowEdge {
    Objects.requireNonNull(iid, "iid");
    Objects.requireNonNull(oid, "oid");
    if (formatter != null && formatter.isEmpty()) formatter = null;
  }

  public FlowEdge(String iid, String oid) {
    this(iid, oid, null);
  }

  @Override
  public PlanEdge renamed(UnaryOperator<String> rename) {
    return new FlowEdge(rename.apply(iid), rename.apply(oid), formatter);
  }

  @Override
  public ObjectNode toJson() {
    ObjectNode node = JacksonUtility.createObjectNode();
    node.put("iid", iid);
    node.put("oid", oid);
    if (formatter != null) node.put("formatter", formatter);
    return node;
  }
}
