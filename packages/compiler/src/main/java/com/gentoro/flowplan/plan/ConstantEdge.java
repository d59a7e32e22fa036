package com.gentoro.flowplan.plan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.flowplan.utility.JacksonUtility;
import java.util.Objects;
import java.util.function.UnaryOperator;

/** Literal value fed into one input slot of {@code oid}. */
public record ConstantEdge(JsonNode constant, String oid) implements PlanEdge {
  public ConstantEdge {
    constant = constant == null ? NullNode.getInstance() : constant;
    Objects.requireNonNull(oid, "oid");
  }

  @Override
  public PlanEdge renamed(UnaryOperator<String> rename) {
    return new ConstantEdge(constant, rename.apply(oid));
  }

  @Override
  public ObjectNode toJson() {
    ObjectNode node = JacksonUtility.createObjectNode();
    node.set("constant", constant.deepCopy());
    node.put("oid", oid);
    return node;
  }
}
