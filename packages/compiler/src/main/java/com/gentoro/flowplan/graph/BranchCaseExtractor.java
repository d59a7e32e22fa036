package com.gentoro.flowplan.graph;

import com.gentoro.flowplan.exception.GraphStructureException;
import com.gentoro.flowplan.node.BranchNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recovers the node sequence of every case of a fork, from the simple paths between the fork and
 * its aggregator. Each case must be a single straight path; a case whose port is not wired is
 * empty.
 */
public final class BranchCaseExtractor {

  /** Case id to the ids strictly between fork and aggregator, in declared case order. */
  public Map<String, List<String>> extract(
      DirectedGraph graph, BranchNode fork, String aggregatorId) {
    List<List<String>> paths = graph.allSimplePaths(fork.id(), aggregatorId);
    if (paths.isEmpty()) {
      throw new GraphStructureException(
          "Fork never reaches its aggregator", context(fork, aggregatorId));
    }

    Map<String, List<List<String>>> byCase = new LinkedHashMap<>();
    fork.caseIds().forEach(caseId -> byCase.put(caseId, new ArrayList<>()));
    for (List<String> path : paths) {
      List<String> interior = path.subList(1, path.size() - 1);
      if (interior.isEmpty()) {
        throw new GraphStructureException(
            "Fork must not connect directly to its aggregator", context(fork, aggregatorId));
      }
      String first = interior.get(0);
      String caseId =
          fork.caseOf(first)
              .orElseThrow(
                  () ->
                      new GraphStructureException(
                          "Branch node is not bound to any case of its fork",
                          Map.of("forkId", fork.id(), "nodeId", first)));
      List<List<String>> casePaths = byCase.get(caseId);
      if (casePaths == null) {
        throw new GraphStructureException(
            "Branch leaves its fork through an undeclared case",
            Map.of("forkId", fork.id(), "caseId", caseId));
      }
      casePaths.add(new ArrayList<>(interior));
    }

    Map<String, List<String>> result = new LinkedHashMap<>();
    byCase.forEach(
        (caseId, casePaths) -> {
          if (casePaths.size() > 1) {
            throw new GraphStructureException(
                "Nested branching inside a case is not supported",
                Map.of("forkId", fork.id(), "caseId", caseId, "paths", casePaths.size()));
          }
          result.put(caseId, casePaths.isEmpty() ? List.of() : casePaths.get(0));
        });
    return result;
  }

  private static Map<String, Object> context(BranchNode fork, String aggregatorId) {
    return Map.of("forkId", fork.id(), "aggregatorId", aggregatorId);
  }
}
