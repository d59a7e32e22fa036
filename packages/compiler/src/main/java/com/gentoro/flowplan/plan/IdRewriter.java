package com.gentoro.flowplan.plan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.gentoro.flowplan.node.HttpToolNode;
import com.gentoro.flowplan.node.WebNode;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Namespaces node ids per app instance as {@code "<appId>-<id>"}, so one graph can be instantiated
 * several times in the same engine.
 *
 * <p>Branch children are renamed at every depth, as are edge endpoints. The {@code __start__} and
 * {@code __end__} sentinels, empty ids and resource ids stay as they are. Web resources get their
 * {@code history} node ids renamed; HTTP tool resources take their published provider name. Nested
 * sub-canvas plans are left alone: they are namespaced with their own app id when compiled.
 */
public final class IdRewriter {
  public static final Set<String> SENTINELS = Set.of("__start__", "__end__");

  /**
   * @param appId namespace; a random UUID when {@code null}
   * @return canvas id to rewritten id for every renamed node
   */
  public Map<String, String> rewrite(Plan plan, String appId) {
    String namespace = appId == null ? UUID.randomUUID().toString() : appId;
    UnaryOperator<String> rename = id -> namespaced(namespace, id);

    Map<String, String> mapping = new LinkedHashMap<>();
    for (PlanNode top : plan.nodes()) {
      for (PlanNode node : top.selfAndDescendants()) {
        String renamed = rename.apply(node.id());
        mapping.put(node.originalId(), renamed);
        node.rename(renamed);
      }
    }

    for (PlanNode resource : plan.resources()) {
      String kind = resource.kind() == null ? "" : resource.kind().toLowerCase(Locale.ROOT);
      if (WebNode.KIND.equals(kind)) {
        JsonNode history = resource.args().get("history");
        if (history instanceof ArrayNode entries) {
          for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).isTextual()) {
              entries.set(i, TextNode.valueOf(rename.apply(entries.get(i).textValue())));
            }
          }
        }
      } else if (HttpToolNode.KIND.equals(kind)) {
        resource
            .extra(HttpToolNode.PROVIDER_NAME_EXTRA)
            .filter(JsonNode::isTextual)
            .ifPresent(name -> resource.setName(name.textValue()));
      }
    }

    plan.edges().replaceAll(edge -> edge.renamed(rename));
    plan.recordIdMapping(mapping);
    return mapping;
  }

  public static String namespaced(String appId, String id) {
    if (id == null || id.isEmpty() || SENTINELS.contains(id)) return id;
    return appId + "-" + id;
  }
}
