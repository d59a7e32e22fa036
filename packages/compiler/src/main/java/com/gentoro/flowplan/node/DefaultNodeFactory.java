package com.gentoro.flowplan.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowplan.converter.ConverterSettings;
import com.gentoro.flowplan.exception.UnsupportedFeatureException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Node factory covering the structural kinds plus the payload kinds shipped with the compiler.
 * Further kinds can be added with {@link #register}.
 */
public class DefaultNodeFactory implements NodeFactory {

  /** Creates a node of one registered kind. */
  @FunctionalInterface
  public interface NodeConstructor {
    Node create(JsonNode raw, NodeContext context);
  }

  private final Map<String, NodeConstructor> constructors = new ConcurrentHashMap<>();
  private final NodeContext context;

  public DefaultNodeFactory() {
    this(ReferenceResolver.NONE, ConverterSettings.defaults());
  }

  public DefaultNodeFactory(ReferenceResolver resolver, ConverterSettings settings) {
    this.context = new NodeContext(this, resolver, settings);
    registerDefaults();
  }

  private void registerDefaults() {
    for (String kind : NodeCategory.START_KINDS) register(kind, StructuralNode::new);
    for (String kind : NodeCategory.END_KINDS) register(kind, StructuralNode::new);
    for (String kind : NodeCategory.AGGREGATOR_KINDS) register(kind, StructuralNode::new);

    register("ifs", IfsNode::new);
    register("switch", SwitchNode::new);
    register("intention", IntentionNode::new);

    register("subgraph", SubgraphNode::new);
    register("app", SubgraphNode::new);
    register("template", SubgraphNode::new);
    register("loop", LoopNode::new);
    register("warp", WarpNode::new);

    register("code", CodeNode::new);
    register("retriever", RetrieverNode::new);
    register("functioncall", FunctionCallNode::new);
    register("onlinellm", OnlineLlmNode::new);
    register("sharedllm", SharedLlmNode::new);
    register("document", DocumentNode::new);
    register("file", FileNode::new);
    register(WebNode.KIND, WebNode::new);
    register(ServerNode.KIND, ServerNode::new);
    register(HttpToolNode.KIND, HttpToolNode::new);
  }

  /** Registers or replaces the constructor for {@code kind} (case-insensitive). */
  public DefaultNodeFactory register(String kind, NodeConstructor constructor) {
    constructors.put(
        Objects.requireNonNull(kind, "kind").toLowerCase(Locale.ROOT),
        Objects.requireNonNull(constructor, "constructor"));
    return this;
  }

  @Override
  public Node create(JsonNode raw) {
    String kind = BaseNode.declaredKind(raw);
    NodeConstructor constructor = constructors.get(kind.toLowerCase(Locale.ROOT));
    if (constructor == null) {
      throw new UnsupportedFeatureException(
          "Invalid node type: " + kind, Map.of("kind", kind, "node", String.valueOf(raw)));
    }
    return constructor.create(raw, context);
  }
}
