package com.gentoro.flowplan.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.gentoro.flowplan.exception.ValidationException;
import com.gentoro.flowplan.graph.Edge;
import com.gentoro.flowplan.plan.PlanNode;
import com.gentoro.flowplan.utility.JacksonUtility;
import com.gentoro.flowplan.utility.StringUtility;
import java.util.ArrayList;
import java.util.Arrays;
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
 * Common behaviour of canvas nodes: identity, port bookkeeping, constant inputs, resource
 * references and the shared part of the plan representation.
 *
 * <p>Subclasses read their payload in the constructor, register referenced resources with {@link
 * #useResource} and fill in {@code args} in {@link #describe(PlanNode)}.
 */
public abstract class BaseNode implements Node {
  private static final org.slf4j.Logger log =
      com.gentoro.flowplan.logging.LoggingService.getLogger(BaseNode.class);

  static final String MODE_CONST = "mode-const";

  /** Argument the engine reads to report per-node progress; set on every compiled node. */
  public static final String ENABLE_REPORT_ARG = "_lazyllm_enable_report";

  protected final JsonNode raw;
  protected final JsonNode data;
  protected final NodeContext context;

  private final String id;
  private final String declaredKind;
  private final List<String> inputPorts;
  private final Edge[] boundInputs;
  private final List<ConstantInput> constantEdges;
  private final Map<String, List<String>> resourceRefs = new LinkedHashMap<>();

  protected BaseNode(JsonNode raw, NodeContext context) {
    String nodeId = JacksonUtility.text(raw, "id");
    if (StringUtility.isBlank(nodeId)) {
      throw new ValidationException(
          "Node definition has no id", Map.of("node", String.valueOf(raw)));
    }
    this.raw = raw;
    this.id = nodeId;
    this.context = Objects.requireNonNull(context, "context");
    JsonNode d = raw.get("data");
    this.data = d != null && d.isObject() ? d : JacksonUtility.createObjectNode();
    this.declaredKind = declaredKind(raw);

    List<String> ports = new ArrayList<>();
    for (JsonNode port : JacksonUtility.elements(data, "config__input_ports")) {
      ports.add(JacksonUtility.text(port, "id"));
    }
    this.inputPorts = Collections.unmodifiableList(ports);
    this.boundInputs = new Edge[ports.size()];

    List<ConstantInput> constants = new ArrayList<>();
    List<JsonNode> shape = inputShape();
    for (int i = 0; i < shape.size(); i++) {
      JsonNode slot = shape.get(i);
      if (MODE_CONST.equals(JacksonUtility.text(slot, "variable_mode"))
          && !"file".equals(JacksonUtility.text(slot, "variable_type"))) {
        JsonNode value = slot.get("variable_const");
        constants.add(new ConstantInput(value == null ? NullNode.getInstance() : value, i));
      }
    }
    this.constantEdges = Collections.unmodifiableList(constants);
  }

  /** {@code data.payload__kind}, falling back to {@code data.type}; empty when neither is set. */
  public static String declaredKind(JsonNode raw) {
    JsonNode d = raw == null ? null : raw.get("data");
    String kind = JacksonUtility.text(d, "payload__kind");
    if (StringUtility.isBlank(kind)) kind = JacksonUtility.text(d, "type");
    return kind == null ? "" : kind;
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public String kind() {
    return declaredKind;
  }

  @Override
  public NodeCategory category() {
    return NodeCategory.of(lowerKind());
  }

  @Override
  public JsonNode raw() {
    return raw;
  }

  @Override
  public List<String> inputPorts() {
    return inputPorts;
  }

  @Override
  public void bindInputPort(String portId, Edge edge) {
    int index = inputPorts.indexOf(portId);
    if (index < 0) {
      log.debug("Node {} has no input port {}; edge {} left unordered", id, portId, edge);
      return;
    }
    boundInputs[index] = edge;
  }

  @Override
  public List<Edge> boundInputs() {
    List<Edge> out = new ArrayList<>();
    Arrays.stream(boundInputs).filter(Objects::nonNull).forEach(out::add);
    return out;
  }

  @Override
  public List<ConstantInput> constantEdges() {
    return constantEdges;
  }

  @Override
  public Set<String> usedResources() {
    Set<String> ids = new LinkedHashSet<>();
    resourceRefs.values().forEach(ids::addAll);
    return ids;
  }

  /** Registers a referenced resource under {@code key}; blank ids are ignored. */
  protected void useResource(String key, String resourceId) {
    useResources(key, resourceId == null ? List.of() : List.of(resourceId));
  }

  protected void useResources(String key, Collection<String> resourceIds) {
    List<String> ids = new ArrayList<>();
    for (String rid : resourceIds) {
      if (!StringUtility.isBlank(rid)) ids.add(rid);
    }
    resourceRefs.put(key, ids);
  }

  @Override
  public Optional<PlanNode> toPlanNode() {
    PlanNode node = new PlanNode(id, kind());
    JsonNode backflow = data.get("enable_backflow");
    node.putExtra("enable_backflow", backflow == null ? BooleanNode.FALSE : backflow.deepCopy());
    node.putExtra("title", TextNode.valueOf(JacksonUtility.text(data, "title", "")));
    describe(node);
    node.args().put(ENABLE_REPORT_ARG, true);
    node.useResources(usedResources());
    return Optional.of(node);
  }

  /** Fills kind-specific arguments and extras. */
  protected abstract void describe(PlanNode node);

  protected List<JsonNode> inputShape() {
    return JacksonUtility.elements(data, "config__input_shape");
  }

  /** Input variable names in slot order. */
  protected List<String> inputNames() {
    List<String> names = new ArrayList<>();
    for (JsonNode slot : inputShape()) {
      names.add(JacksonUtility.text(slot, "variable_name"));
    }
    return names;
  }

  /** Constant file input, if one is configured. */
  protected String fileResourceId() {
    for (JsonNode slot : inputShape()) {
      if ("file".equals(JacksonUtility.text(slot, "variable_type"))
          && MODE_CONST.equals(JacksonUtility.text(slot, "variable_mode"))) {
        String value = JacksonUtility.text(slot, "variable_const");
        return StringUtility.isBlank(value) ? null : value;
      }
    }
    return null;
  }

  /** Text of a data field, {@code null} when absent. */
  protected String text(String field) {
    return JacksonUtility.text(data, field);
  }

  /** Copy of a data field, JSON null when absent. */
  protected JsonNode value(String field) {
    JsonNode value = data.get(field);
    return value == null ? NullNode.getInstance() : value.deepCopy();
  }

  protected boolean flag(String field) {
    return JacksonUtility.isTruthy(data.get(field));
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{id=" + id + ", kind=" + declaredKind + '}';
  }
}
