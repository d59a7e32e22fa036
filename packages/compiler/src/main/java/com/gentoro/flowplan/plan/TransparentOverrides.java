package com.gentoro.flowplan.plan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.flowplan.node.NodeFactory;
import com.gentoro.flowplan.node.SubgraphNode;
import com.gentoro.flowplan.utility.JacksonUtility;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Applies a parent canvas's overrides to the nodes of an embedded canvas.
 *
 * <p>A sub-canvas node lists overrides under {@code extras-config__patent_data} as {@code {childId:
 * rawNodeData}}. The child is looked up by its canvas id among the embedded plan's nodes and their
 * direct branch children. The override data is compiled into node args by the {@link NodeFactory}
 * and merged over the child's args, except for branch keys. Overrides whose child does not exist
 * are logged and skipped.
 */
public final class TransparentOverrides {
  private static final org.slf4j.Logger log =
      com.gentoro.flowplan.logging.LoggingService.getLogger(TransparentOverrides.class);

  static final Set<String> PROTECTED_ARGS = Set.of("nodes", "true", "false");

  private final NodeFactory factory;

  public TransparentOverrides(NodeFactory factory) {
    this.factory = factory;
  }

  public void apply(Plan plan) {
    for (PlanNode top : plan.nodes()) {
      for (PlanNode node : top.selfAndDescendants()) {
        node.subPlan().ifPresent(sub -> applyTo(node, sub));
      }
    }
  }

  private void applyTo(PlanNode owner, Plan sub) {
    JsonNode overrides = owner.extra(SubgraphNode.PATENT_DATA_EXTRA).orElse(null);
    if (overrides != null && overrides.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> it = overrides.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> entry = it.next();
        Optional<PlanNode> match = findChild(sub, entry.getKey());
        if (match.isEmpty()) {
          log.error(
              "Override target {} not found in sub-canvas {}; skipped", entry.getKey(), owner.id());
          continue;
        }
        ObjectNode update = overrideArgs(entry.getKey(), entry.getValue());
        log.info("Overriding {} in sub-canvas {} with {}", entry.getKey(), owner.id(), update);
        match.get().args().setAll(update);
      }
    }
    apply(sub);
  }

  private static Optional<PlanNode> findChild(Plan sub, String canvasId) {
    for (PlanNode node : sub.nodes()) {
      if (matches(node, canvasId)) return Optional.of(node);
      for (PlanNode child : node.children()) {
        if (matches(child, canvasId)) return Optional.of(child);
      }
    }
    return Optional.empty();
  }

  private static boolean matches(PlanNode node, String canvasId) {
    return canvasId.equals(node.originalId()) || canvasId.equals(node.name());
  }

  private ObjectNode overrideArgs(String canvasId, JsonNode data) {
    ObjectNode raw = JacksonUtility.createObjectNode();
    raw.put("id", canvasId);
    raw.set("data", data);
    ObjectNode args =
        factory
            .create(raw)
            .toPlanNode()
            .map(node -> node.args().deepCopy())
            .orElseGet(JacksonUtility::createObjectNode);
    args.remove(PROTECTED_ARGS);
    return args;
  }
}
