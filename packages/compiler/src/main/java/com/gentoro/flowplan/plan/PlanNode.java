package com.gentoro.flowplan.plan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.gentoro.flowplan.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Serialisable node of a compiled plan.
 *
 * <p>Extras are written as top-level {@code extras-<key>} properties. Fork nodes carry their case
 * lists as {@link Branches}; sub-canvas nodes carry their compiled {@link Plan}, whose nodes, edges
 * and resources become part of {@code args} on serialisation. The id a node had on the canvas is
 * remembered in {@link #originalId()} after id rewriting.
 */
public final class PlanNode {
  public static final String EXTRAS_PREFIX = "extras-";

  private String id;
  private final String originalId;
  private String kind;
  private String name;
  private final ObjectNode args = JacksonUtility.createObjectNode();
  private final ObjectNode hyperparameter = JacksonUtility.createObjectNode();
  private final Map<String, JsonNode> extras = new LinkedHashMap<>();
  private final Set<String> usedResources = new LinkedHashSet<>();
  private Branches branches;
  private Plan subPlan;

  public PlanNode(String id, String kind) {
    this.id = Objects.requireNonNull(id, "id");
    this.originalId = id;
    this.kind = kind;
    this.name = id;
  }

  public String id() {
    return id;
  }

  void rename(String newId) {
    this.id = newId;
  }

  public String originalId() {
    return originalId;
  }

  public String kind() {
    return kind;
  }

  public PlanNode setKind(String kind) {
    this.kind = kind;
    return this;
  }

  public String name() {
    return name;
  }

  public PlanNode setName(String name) {
    this.name = name;
    return this;
  }

  /** Live, mutable argument object. */
  public ObjectNode args() {
    return args;
  }

  public ObjectNode hyperparameter() {
    return hyperparameter;
  }

  public Map<String, JsonNode> extras() {
    return Collections.unmodifiableMap(extras);
  }

  public Optional<JsonNode> extra(String key) {
    return Optional.ofNullable(extras.get(key));
  }

  public PlanNode putExtra(String key, JsonNode value) {
    extras.put(key, value);
    return this;
  }

  public PlanNode putExtra(String key, String value) {
    return putExtra(key, value == null ? null : TextNode.valueOf(value));
  }

  public PlanNode putExtra(String key, boolean value) {
    return putExtra(key, BooleanNode.valueOf(value));
  }

  /** Resource ids this node references; not serialised. */
  public Set<String> usedResources() {
    return Collections.unmodifiableSet(usedResources);
  }

  public PlanNode useResources(Collection<String> ids) {
    usedResources.addAll(ids);
    return this;
  }

  public Optional<Branches> branches() {
    return Optional.ofNullable(branches);
  }

  public PlanNode setBranches(Branches branches) {
    this.branches = branches;
    return this;
  }

  public Optional<Plan> subPlan() {
    return Optional.ofNullable(subPlan);
  }

  public PlanNode setSubPlan(Plan subPlan) {
    this.subPlan = subPlan;
    return this;
  }

  /** Direct branch children, empty for non-fork nodes. */
  public List<PlanNode> children() {
    return branches == null ? List.of() : branches.children();
  }

  /** This node followed by every branch descendant, depth first. */
  public List<PlanNode> selfAndDescendants() {
    List<PlanNode> out = new ArrayList<>();
    collect(this, out);
    return out;
  }

  private static void collect(PlanNode node, List<PlanNode> out) {
    out.add(node);
    for (PlanNode child : node.children()) {
      collect(child, out);
    }
  }

  public ObjectNode toJson() {
    ObjectNode json = JacksonUtility.createObjectNode();
    json.put("id", id);
    json.put("kind", kind);
    json.put("name", name);
    json.set("hyperparameter", hyperparameter.deepCopy());

    ObjectNode outArgs = json.putObject("args");
    if (subPlan != null) {
      outArgs.setAll(subPlan.toJson());
    }
    outArgs.setAll(args.deepCopy());
    if (branches != null) {
      branches.writeTo(outArgs);
    }

    extras.forEach(
        (key, value) ->
            json.set(EXTRAS_PREFIX + key, value == null ? json.nullNode() : value.deepCopy()));
    return json;
  }

  @Override
  public String toString() {
    return "PlanNode{id=" + id + ", kind=" + kind + '}';
  }
}
