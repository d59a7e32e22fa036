package com.gentoro.flowplan.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Directed graph that keeps insertion order everywhere.
 *
 * <p>Nodes are ordered by first appearance (an edge adds its source before its target), successors
 * by the order their edges were added. {@link #edges()} walks nodes in that order and each node's
 * successors in turn, so edge order is reproducible for a given edge list. Adding an existing edge
 * again only replaces its formatter.
 */
public final class DirectedGraph {
  private final Map<String, Map<String, String>> successors = new LinkedHashMap<>();

  public static DirectedGraph fromRawEdges(Collection<RawEdge> edges) {
    DirectedGraph graph = new DirectedGraph();
    edges.forEach(e -> graph.addEdge(e.source(), e.target(), e.label()));
    return graph;
  }

  public static DirectedGraph fromEdges(Collection<Edge> edges) {
    DirectedGraph graph = new DirectedGraph();
    edges.forEach(e -> graph.addEdge(e.source(), e.target(), null));
    return graph;
  }

  public void addEdge(String source, String target, String formatter) {
    successors.computeIfAbsent(source, k -> new LinkedHashMap<>());
    successors.computeIfAbsent(target, k -> new LinkedHashMap<>());
    successors.get(source).put(target, formatter == null ? "" : formatter);
  }

  public Set<String> nodes() {
    return Collections.unmodifiableSet(successors.keySet());
  }

  public boolean hasEdge(String source, String target) {
    Map<String, String> next = successors.get(source);
    return next != null && next.containsKey(target);
  }

  /** Formatter of an edge; empty when the edge is absent or carries none. */
  public Optional<String> formatter(String source, String target) {
    Map<String, String> next = successors.get(source);
    if (next == null) return Optional.empty();
    String formatter = next.get(target);
    return formatter == null || formatter.isEmpty() ? Optional.empty() : Optional.of(formatter);
  }

  public List<Edge> edges() {
    List<Edge> out = new ArrayList<>();
    successors.forEach((source, next) -> next.keySet().forEach(t -> out.add(new Edge(source, t))));
    return out;
  }

  /**
   * Every path from {@code source} to {@code target} that visits no node twice. Paths end at the
   * first arrival at {@code target}; they are produced in depth-first successor order.
   */
  public List<List<String>> allSimplePaths(String source, String target) {
    List<List<String>> paths = new ArrayList<>();
    if (!successors.containsKey(source) || !successors.containsKey(target)) return paths;
    LinkedHashSet<String> visited = new LinkedHashSet<>();
    visited.add(source);
    walk(source, target, visited, paths);
    return paths;
  }

  private void walk(
      String current, String target, LinkedHashSet<String> visited, List<List<String>> paths) {
    for (String next : successors.get(current).keySet()) {
      if (visited.contains(next)) continue;
      if (next.equals(target)) {
        List<String> path = new ArrayList<>(visited);
        path.add(target);
        paths.add(path);
        continue;
      }
      visited.add(next);
      walk(next, target, visited, paths);
      visited.remove(next);
    }
  }
}
