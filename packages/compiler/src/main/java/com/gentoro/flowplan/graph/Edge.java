package com.gentoro.flowplan.graph;

import java.util.Objects;

/** Directed connection between two node ids. */
public record Edge(String source, String target) {
  public Edge {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(target, "target");
  }

  @Override
  public String toString() {
    return source + " -> " + target;
  }
}
