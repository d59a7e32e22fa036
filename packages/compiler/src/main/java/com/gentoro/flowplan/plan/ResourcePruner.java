package com.gentoro.flowplan.plan;

import com.gentoro.flowplan.converter.ConverterSettings;
import java.util.LinkedHashSet;
import java.util.Set;

/** Drops resources nothing refers to, except the always-kept kinds (server and web by default). */
public final class ResourcePruner {
  private static final org.slf4j.Logger log =
      com.gentoro.flowplan.logging.LoggingService.getLogger(ResourcePruner.class);

  private final ConverterSettings settings;

  public ResourcePruner(ConverterSettings settings) {
    this.settings = settings;
  }

  /** Resource ids referenced by nodes (branch children included) and by other resources. */
  public Set<String> usedResources(Plan plan) {
    Set<String> used = new LinkedHashSet<>();
    for (PlanNode node : plan.nodes()) {
      node.selfAndDescendants().forEach(n -> used.addAll(n.usedResources()));
    }
    for (PlanNode resource : plan.resources()) {
      used.addAll(resource.usedResources());
    }
    return used;
  }

  public void prune(Plan plan) {
    Set<String> used = usedResources(plan);
    int before = plan.resources().size();
    plan.resources()
        .removeIf(r -> !used.contains(r.id()) && !settings.isAlwaysKept(r.kind()));
    log.debug("Kept {} of {} resources; referenced: {}", plan.resources().size(), before, used);
  }
}
