package com.gentoro.flowplan.graph;

import com.gentoro.flowplan.exception.GraphStructureException;
import com.gentoro.flowplan.exception.UnsupportedFeatureException;
import com.gentoro.flowplan.node.BranchNode;
import com.gentoro.flowplan.node.Node;
import com.gentoro.flowplan.plan.PlanNode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Contracts fork/aggregator regions into single fork nodes that own their branches.
 *
 * <p>Each pass sorts the current edge list, finds the first balanced fork/aggregator pair, replaces
 * every edge from the fork up to the aggregator's outgoing edge with one edge from the fork to the
 * aggregator's successor, and builds the fork's branches from the canvas graph. Passes repeat until
 * no pair is left, so the number of passes is bounded by the number of forks.
 */
public final class ForkAggregatorResolver {
  private static final org.slf4j.Logger log =
      com.gentoro.flowplan.logging.LoggingService.getLogger(ForkAggregatorResolver.class);

  private final PathSorter sorter;
  private final BranchCaseExtractor extractor;

  public ForkAggregatorResolver() {
    this(new PathSorter(), new BranchCaseExtractor());
  }

  public ForkAggregatorResolver(PathSorter sorter, BranchCaseExtractor extractor) {
    this.sorter = sorter;
    this.extractor = extractor;
  }

  /** Final start-to-end edge sequence; contracted forks are recorded in the session. */
  public List<Edge> resolve(CompilationSession session) {
    List<Edge> edges = contract(session.fullGraph().edges(), null, session);
    for (String forkId : session.index().forkIds()) {
      if (!session.isUsedFork(forkId)) {
        log.warn("Fork {} has no matching aggregator; its branches stay empty", forkId);
      }
    }
    return edges;
  }

  private List<Edge> contract(
      List<Edge> edges, ForkAggregatorPair correction, CompilationSession session) {
    List<Edge> sorted = sorter.sort(DirectedGraph.fromEdges(edges), session, correction);
    int[] pair = findPair(sorted, session);
    if (pair == null) {
      return sorted;
    }

    int forkIndex = pair[0];
    int aggregatorIndex = pair[1];
    String forkId = sorted.get(forkIndex).source();
    String aggregatorId = sorted.get(aggregatorIndex).source();
    log.debug("Contracting region {} .. {}", forkId, aggregatorId);

    List<Edge> next = new ArrayList<>(sorted.subList(0, forkIndex));
    next.add(new Edge(forkId, sorted.get(aggregatorIndex).target()));
    next.addAll(sorted.subList(aggregatorIndex + 1, sorted.size()));

    session.finalizeFork(forkId, buildFork(forkId, aggregatorId, session));
    return contract(next, new ForkAggregatorPair(forkId, aggregatorId), session);
  }

  /** Positions of the first balanced fork/aggregator pair, {@code null} when there is none. */
  private static int[] findPair(List<Edge> sorted, CompilationSession session) {
    GraphIndex index = session.index();
    int level = 0;
    int forkIndex = -1;
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < sorted.size(); i++) {
      String iid = sorted.get(i).source();
      if (session.isUsedFork(iid) || seen.contains(iid)) continue;
      seen.add(iid);

      if (index.isFork(iid)) {
        if (level == 0) forkIndex = i;
        level++;
      } else if (index.isAggregator(iid)) {
        if (level == 0) {
          throw new GraphStructureException(
              "Aggregator closes no open fork", Map.of("aggregatorId", iid));
        }
        level--;
        if (level == 0) return new int[] {forkIndex, i};
      }
    }
    return null;
  }

  private PlanNode buildFork(String forkId, String aggregatorId, CompilationSession session) {
    GraphIndex index = session.index();
    Node node = index.node(forkId);
    if (!(node instanceof BranchNode fork)) {
      throw new UnsupportedFeatureException(
          "Fork kind has no branch support: " + node.kind(), Map.of("nodeId", forkId));
    }

    Map<String, List<String>> casePaths =
        extractor.extract(session.fullGraph(), fork, aggregatorId);
    Map<String, List<PlanNode>> caseNodes = new LinkedHashMap<>();
    casePaths.forEach(
        (caseId, ids) -> {
          List<PlanNode> children = new ArrayList<>();
          ids.forEach(id -> index.node(id).toPlanNode().ifPresent(children::add));
          caseNodes.put(caseId, children);
        });

    PlanNode forkNode =
        fork.toPlanNode()
            .orElseThrow(
                () ->
                    new UnsupportedFeatureException(
                        "Fork has no plan representation", Map.of("nodeId", forkId)));
    forkNode.setBranches(fork.toBranches(caseNodes));
    return forkNode;
  }
}
