package com.gentoro.flowplan.plan;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.flowplan.utility.StringUtility;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Multi-way branch of a {@code switch} or {@code intention} node.
 *
 * <p>Keys are {@link Long}, {@link Double} or {@link String} values, kept in insertion order. A
 * later case with an equal key replaces the earlier one.
 */
public final class CaseBranches implements Branches {
  public static final String DEFAULT_KEY = "default";

  private final Map<Object, List<PlanNode>> cases = new LinkedHashMap<>();

  public CaseBranches put(Object key, List<PlanNode> nodes) {
    cases.put(key, List.copyOf(nodes));
    return this;
  }

  public Map<Object, List<PlanNode>> cases() {
    return Collections.unmodifiableMap(cases);
  }

  public List<PlanNode> nodes(Object key) {
    return cases.getOrDefault(key, List.of());
  }

  /** Moves the {@code default} case, if present, behind every other case. */
  public CaseBranches defaultLast() {
    List<PlanNode> fallback = cases.remove(DEFAULT_KEY);
    if (fallback != null) cases.put(DEFAULT_KEY, fallback);
    return this;
  }

  @Override
  public List<PlanNode> children() {
    List<PlanNode> all = new ArrayList<>();
    cases.values().forEach(all::addAll);
    return all;
  }

  @Override
  public void writeTo(ObjectNode args) {
    ObjectNode nodes = args.putObject("nodes");
    cases.forEach((key, value) -> nodes.set(label(key), ConditionalBranches.toArray(args, value)));
  }

  /** JSON object key for a case key. */
  public static String label(Object key) {
    if (key instanceof Double d) return StringUtility.formatDecimal(d);
    return String.valueOf(key);
  }
}
