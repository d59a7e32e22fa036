package com.gentoro.flowplan.node;

import java.util.Locale;
import java.util.Set;

/** Structural role of a node as far as control-flow recovery is concerned. */
public enum NodeCategory {
  START,
  END,
  FORK,
  AGGREGATOR,
  SUBGRAPH,
  STANDARD;

  static final Set<String> START_KINDS = Set.of("start", "__start__");
  static final Set<String> END_KINDS = Set.of("end", "__end__", "answer");
  static final Set<String> FORK_KINDS = Set.of("ifs", "switch", "intention");
  static final Set<String> AGGREGATOR_KINDS = Set.of("aggregator");
  static final Set<String> SUBGRAPH_KINDS = Set.of("subgraph", "warp", "loop", "app", "template");

  public static NodeCategory of(String kind) {
    String k = kind == null ? "" : kind.toLowerCase(Locale.ROOT);
    if (FORK_KINDS.contains(k)) return FORK;
    if (START_KINDS.contains(k)) return START;
    if (AGGREGATOR_KINDS.contains(k)) return AGGREGATOR;
    if (END_KINDS.contains(k)) return END;
    if (SUBGRAPH_KINDS.contains(k)) return SUBGRAPH;
    return STANDARD;
  }

  /** Start, end and aggregator nodes never appear in a plan. */
  public boolean isStructural() {
    return this == START || this == END || this == AGGREGATOR;
  }
}
