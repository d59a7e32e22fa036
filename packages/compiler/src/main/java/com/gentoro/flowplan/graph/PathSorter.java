package com.gentoro.flowplan.graph;

import com.gentoro.flowplan.exception.EdgeProcessingException;
import com.gentoro.flowplan.exception.GraphStructureException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Orders the edges of a graph from start to end.
 *
 * <p>Outgoing edges carry no order on the canvas but input ports do, so the walk runs backwards
 * from the end node. At every node the incoming edges are visited from the last declared port to
 * the first, each followed up to the start node, and the collected sequence is
 * reversed at the end. Aggregators only follow their first incoming edge: the other branches of
 * their region are recovered separately when the region is contracted.
 */
public final class PathSorter {
  private static final org.slf4j.Logger log =
      com.gentoro.flowplan.logging.LoggingService.getLogger(PathSorter.class);

  /**
   * @param correction the region contracted in the previous pass, whose aggregator is now reached
   *     through its fork; {@code null} on the first pass
   */
  public List<Edge> sort(
      DirectedGraph graph, CompilationSession session, ForkAggregatorPair correction) {
    GraphIndex index = session.index();
    Optional<String> endId = index.endId();
    if (endId.isEmpty()) {
      return List.of();
    }

    Map<String, List<Edge>> incoming = new LinkedHashMap<>();
    for (Edge edge : graph.edges()) {
      incoming.computeIfAbsent(edge.target(), k -> new ArrayList<>()).add(edge);
    }
    orderByDeclaredPorts(incoming, session.sortingInputs(), correction);

    Walk walk =
        new Walk(incoming, index, index.startId().orElse(null), session.settings().maxDepth());
    try {
      walk.run(endId.get());
    } catch (GraphStructureException | EdgeProcessingException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new EdgeProcessingException(Map.of("endId", endId.get()), e);
    }

    List<Edge> sorted = new ArrayList<>(walk.collected);
    Collections.reverse(sorted);
    log.debug("Sorted edges: {}", sorted);
    return sorted;
  }

  private static void orderByDeclaredPorts(
      Map<String, List<Edge>> incoming,
      Map<String, List<Edge>> sortingInputs,
      ForkAggregatorPair correction) {
    for (Map.Entry<String, List<Edge>> entry : incoming.entrySet()) {
      List<Edge> declared = sortingInputs.get(entry.getKey());
      if (declared == null) continue;
      if (correction != null) {
        declared.replaceAll(
            e ->
                e.source().equals(correction.aggregatorId())
                    ? new Edge(correction.forkId(), e.target())
                    : e);
      }
      // stable: the last declared port is walked first; undeclared edges before all of them
      entry.getValue().sort(Comparator.comparingInt(e -> rank(declared, e)));
    }
  }

  private static int rank(List<Edge> declared, Edge edge) {
    int position = declared.indexOf(edge);
    return position >= 0 ? -position : -declared.size();
  }

  /**
   * Depth-first walk over incoming edges with an explicit stack. A node whose upstream walk has
   * completed is never walked again: every edge above it is already collected.
   */
  private static final class Walk {
    private final Map<String, List<Edge>> incoming;
    private final GraphIndex index;
    private final String startId;
    private final int maxDepth;
    private final List<Edge> collected = new ArrayList<>();
    private final Set<Edge> seen = new HashSet<>();
    private final Set<String> onPath = new HashSet<>();
    private final Set<String> completed = new HashSet<>();

    Walk(Map<String, List<Edge>> incoming, GraphIndex index, String startId, int maxDepth) {
      this.incoming = incoming;
      this.index = index;
      this.startId = startId;
      this.maxDepth = maxDepth;
    }

    void run(String endId) {
      Deque<Frame> stack = new ArrayDeque<>();
      stack.push(open(endId));
      while (!stack.isEmpty()) {
        Frame frame = stack.peek();
        if (frame.next < frame.edges.size()) {
          Edge edge = frame.edges.get(frame.next++);
          append(edge);
          String upstream = upstream(edge);
          if (upstream != null && !completed.contains(upstream)) {
            stack.push(open(upstream));
          }
        } else {
          stack.pop();
          frame.entered.forEach(onPath::remove);
          completed.addAll(frame.entered);
        }
      }
    }

    /** Enters {@code nodeId}, following aggregators through their first incoming edge. */
    private Frame open(String nodeId) {
      List<String> entered = new ArrayList<>();
      String current = nodeId;
      while (current != null && !completed.contains(current)) {
        enter(current, entered);
        List<Edge> edges = incoming.get(current);
        if (edges == null || edges.isEmpty()) {
          throw new EdgeProcessingException(
              Map.of("nodeId", current, "reason", "node has no incoming edge"));
        }
        if (!index.isAggregator(current)) {
          return new Frame(entered, edges);
        }
        Edge first = edges.get(0);
        append(first);
        current = upstream(first);
      }
      return new Frame(entered, List.of());
    }

    private void enter(String nodeId, List<String> entered) {
      if (onPath.contains(nodeId)) {
        throw new GraphStructureException("Graph contains a cycle", Map.of("nodeId", nodeId));
      }
      if (onPath.size() >= maxDepth) {
        throw new GraphStructureException(
            "Graph is deeper than the configured maximum",
            Map.of("nodeId", nodeId, "maxDepth", maxDepth));
      }
      onPath.add(nodeId);
      entered.add(nodeId);
    }

    private void append(Edge edge) {
      if (seen.add(edge)) collected.add(edge);
    }

    private String upstream(Edge edge) {
      return edge.source().equals(startId) ? null : edge.source();
    }
  }

  private static final class Frame {
    private final List<String> entered;
    private final List<Edge> edges;
    private int next;

    Frame(List<String> entered, List<Edge> edges) {
      this.entered = entered;
      this.edges = edges;
    }
  }
}
