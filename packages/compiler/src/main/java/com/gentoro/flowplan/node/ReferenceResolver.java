package com.gentoro.flowplan.node;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import java.util.Optional;

/**
 * Look-ups node kinds need from outside the graph. Every method defaults to "nothing known", so
 * graphs that embed everything they need compile without a resolver.
 */
public interface ReferenceResolver {
  ReferenceResolver NONE = new ReferenceResolver() {};

  /** API key and secret entries merged into a model node's args. */
  default Map<String, String> modelCredentials(String modelId) {
    return Map.of();
  }

  /** Registered HTTP tool for a provider id. */
  default Optional<ToolBinding> toolBinding(String providerId) {
    return Optional.empty();
  }

  /** Id of the user the compilation runs for. */
  default Optional<String> currentUserId() {
    return Optional.empty();
  }

  /** Stored graph of a sub-canvas app that does not embed its own graph. */
  default Optional<JsonNode> subgraph(String appId) {
    return Optional.empty();
  }

  /**
   * @param shared whether the tool's credentials are shared with other users
   */
  record ToolBinding(String toolApiId, String authenticationType, boolean shared) {}
}
