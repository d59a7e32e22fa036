package com.gentoro.flowplan.graph;

import com.gentoro.flowplan.converter.ConverterSettings;
import com.gentoro.flowplan.plan.PlanNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable state of one compilation: the port ordering as rewritten by region contraction, the forks
 * already contracted and their finished plan nodes.
 */
public final class CompilationSession {
  private final GraphIndex index;
  private final ConverterSettings settings;
  private final DirectedGraph fullGraph;
  private final Map<String, List<Edge>> sortingInputs = new LinkedHashMap<>();
  private final Set<String> usedForks = new LinkedHashSet<>();
  private final Map<String, PlanNode> finalizedForks = new LinkedHashMap<>();

  public CompilationSession(GraphIndex index, ConverterSettings settings) {
    this.index = index;
    this.settings = settings;
    this.fullGraph = DirectedGraph.fromRawEdges(index.graph().edges());
    index.targetSortingInputs().forEach((k, v) -> sortingInputs.put(k, new ArrayList<>(v)));
  }

  public GraphIndex index() {
    return index;
  }

  public ConverterSettings settings() {
    return settings;
  }

  /** Graph of the canvas edges as drawn, with their formatters. */
  public DirectedGraph fullGraph() {
    return fullGraph;
  }

  /** Port ordering per target; entries are rewritten as regions are contracted. */
  Map<String, List<Edge>> sortingInputs() {
    return sortingInputs;
  }

  public boolean isUsedFork(String forkId) {
    return usedForks.contains(forkId);
  }

  public Set<String> usedForks() {
    return Collections.unmodifiableSet(usedForks);
  }

  void finalizeFork(String forkId, PlanNode node) {
    usedForks.add(forkId);
    finalizedForks.put(forkId, node);
  }

  public Optional<PlanNode> finalizedFork(String forkId) {
    return Optional.ofNullable(finalizedForks.get(forkId));
  }
}
