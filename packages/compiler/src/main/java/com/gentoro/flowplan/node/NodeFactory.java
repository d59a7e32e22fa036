package com.gentoro.flowplan.node;

import com.fasterxml.jackson.databind.JsonNode;

/** Resolves the node class for a raw canvas node. */
public interface NodeFactory {

  /**
   * @throws com.gentoro.flowplan.exception.UnsupportedFeatureException for an unknown kind
   * @throws com.gentoro.flowplan.exception.ValidationException when the node has no id
   */
  Node create(JsonNode raw);
}
