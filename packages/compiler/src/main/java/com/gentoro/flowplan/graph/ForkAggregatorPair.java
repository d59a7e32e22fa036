package com.gentoro.flowplan.graph;

/** A fork and the aggregator that closes its branch region. */
public record ForkAggregatorPair(String forkId, String aggregatorId) {}
