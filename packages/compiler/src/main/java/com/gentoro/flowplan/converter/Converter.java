package com.gentoro.flowplan.converter;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowplan.ConfigurationProvider;
import com.gentoro.flowplan.exception.ExceptionUtil;
import com.gentoro.flowplan.exception.FlowPlanException;
import com.gentoro.flowplan.exception.NotFoundException;
import com.gentoro.flowplan.exception.SerializationException;
import com.gentoro.flowplan.graph.CompilationSession;
import com.gentoro.flowplan.graph.DirectedGraph;
import com.gentoro.flowplan.graph.Edge;
import com.gentoro.flowplan.graph.ForkAggregatorResolver;
import com.gentoro.flowplan.graph.GraphIndex;
import com.gentoro.flowplan.graph.RawGraph;
import com.gentoro.flowplan.logging.LoggingService;
import com.gentoro.flowplan.node.DefaultNodeFactory;
import com.gentoro.flowplan.node.Node;
import com.gentoro.flowplan.node.NodeFactory;
import com.gentoro.flowplan.node.ReferenceResolver;
import com.gentoro.flowplan.plan.ConstantEdgeInserter;
import com.gentoro.flowplan.plan.FlowEdge;
import com.gentoro.flowplan.plan.HistoryScanner;
import com.gentoro.flowplan.plan.IdRewriter;
import com.gentoro.flowplan.plan.Plan;
import com.gentoro.flowplan.plan.PlanEdge;
import com.gentoro.flowplan.plan.PlanNode;
import com.gentoro.flowplan.plan.ResourcePruner;
import com.gentoro.flowplan.plan.TransparentOverrides;
import com.gentoro.flowplan.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compiles a canvas graph into an executable {@link Plan}.
 *
 * <p>The canvas is indexed and its edges sorted from start to end. Each fork/aggregator region is
 * contracted into a fork node owning its branches. Boundary nodes map to {@code __start__} and
 * {@code __end__}, constant inputs are spliced in, unused resources are dropped, and node ids are
 * namespaced with the app id last.
 *
 * <p>Each call to {@link #toPlan(String)} works on fresh state, so one converter can compile the
 * same canvas several times. A converter is not meant to be shared between threads.
 */
public class Converter {
  private static final org.slf4j.Logger log = LoggingService.getLogger(Converter.class);

  private final RawGraph graph;
  private final NodeFactory factory;
  private final ConverterSettings settings;

  public Converter(JsonNode raw) {
    this(raw, new DefaultNodeFactory(), ConverterSettings.defaults());
  }

  public Converter(String rawJson) {
    this(parse(rawJson));
  }

  public Converter(Map<String, ?> raw) {
    this(JacksonUtility.valueToTree(raw));
  }

  public Converter(JsonNode raw, NodeFactory factory, ConverterSettings settings) {
    this.graph = RawGraph.fromJson(raw);
    this.factory = factory;
    this.settings = settings;
  }

  /**
   * Converter whose settings and log levels come from {@code provider}; node look-ups use the
   * default factory with no reference resolver.
   */
  public static Converter fromConfiguration(JsonNode raw, ConfigurationProvider provider) {
    LoggingService.applyConfiguration(provider.config());
    ConverterSettings settings = ConverterSettings.from(provider.config());
    return new Converter(
        raw,
        new DefaultNodeFactory(ReferenceResolver.NONE, settings),
        settings);
  }

  public ConverterSettings settings() {
    return settings;
  }

  /** Plan namespaced with a random app id. */
  public Plan toPlan() {
    return toPlan(null);
  }

  /**
   * @param appId namespace for node ids; a random UUID when {@code null}
   * @throws FlowPlanException when the canvas cannot be compiled
   */
  public Plan toPlan(String appId) {
    long start = System.currentTimeMillis();
    try {
      Plan plan = compile(new CompilationSession(index(), settings));
      new ResourcePruner(settings).prune(plan);
      new IdRewriter().rewrite(plan, appId);
      log.info(
          "Compiled canvas for app {} into {} in {}ms",
          appId,
          plan,
          System.currentTimeMillis() - start);
      return plan;
    } catch (FlowPlanException e) {
      throw failed(appId, e);
    }
  }

  /**
   * Plan that runs a single node between {@code __start__} and {@code __end__}, for debugging one
   * node of a canvas. The whole canvas is compiled first, so forks are resolved with their
   * branches and structural errors surface as they would for {@link #toPlan(String)}.
   *
   * @param nodeId canvas id of the node, at the top level or inside a fork's branches
   * @throws NotFoundException when the canvas has no plan node with that id
   */
  public Plan toSingleNodePlan(String nodeId, String appId) {
    Plan full;
    try {
      full = compile(new CompilationSession(index(), settings));
    } catch (FlowPlanException e) {
      throw failed(appId, e);
    }
    PlanNode node =
        full.nodes().stream()
            .flatMap(top -> top.selfAndDescendants().stream())
            .filter(n -> n.originalId().equals(nodeId))
            .findFirst()
            .orElseThrow(
                () ->
                    new NotFoundException(
                        "node not found: " + nodeId, Map.of("id", String.valueOf(nodeId))));

    Set<String> used = new LinkedHashSet<>();
    node.selfAndDescendants().forEach(n -> used.addAll(n.usedResources()));
    List<PlanNode> resources = new ArrayList<>();
    for (PlanNode resource : full.resources()) {
      if (used.contains(resource.id()) || settings.isAlwaysKept(resource.kind())) {
        resources.add(resource);
      }
    }

    List<PlanEdge> edges =
        List.of(
            new FlowEdge(GraphIndex.START_SENTINEL, node.id()),
            new FlowEdge(node.id(), GraphIndex.END_SENTINEL));
    Plan plan = new Plan(List.of(node), edges, resources);
    new IdRewriter().rewrite(plan, appId);
    log.info("Compiled single-node plan for {} of app {}", nodeId, appId);
    return plan;
  }

  /** Applies sub-canvas overrides to {@code plan} in place. */
  public void applyTransparentOverrides(Plan plan) {
    new TransparentOverrides(factory).apply(plan);
  }

  /** Ids of nodes that need conversation history. */
  public Set<String> findHistory(Plan plan) {
    return HistoryScanner.find(plan);
  }

  private static FlowPlanException failed(String appId, FlowPlanException e) {
    log.error(
        "Compilation of app {} failed: {} at {}",
        appId,
        ExceptionUtil.toErrorDetails(e),
        ExceptionUtil.formatCompactStackTrace(e, 5));
    return e;
  }

  private GraphIndex index() {
    return GraphIndex.build(graph, factory, settings);
  }

  /** Plan with canvas ids, before pruning and namespacing. */
  Plan compile(CompilationSession session) {
    GraphIndex index = session.index();
    if (index.endId().isEmpty()) {
      log.warn("Canvas has no end node; emitting an empty plan");
    }
    List<Edge> sorted = new ForkAggregatorResolver().resolve(session);
    log.debug("Resolved edge sequence: {}", sorted);

    List<PlanNode> nodes = new ArrayList<>();
    Set<String> placed = new LinkedHashSet<>();
    for (String forkId : session.usedForks()) {
      session.finalizedFork(forkId).ifPresent(nodes::add);
      placed.add(forkId);
    }

    List<PlanEdge> edges = new ArrayList<>();
    String startId = index.startId().orElse(null);
    String endId = index.endId().orElse(null);
    DirectedGraph fullGraph = session.fullGraph();
    for (Edge edge : sorted) {
      if (placed.add(edge.source())) {
        index.node(edge.source()).toPlanNode().ifPresent(nodes::add);
      }
      String iid = edge.source().equals(startId) ? GraphIndex.START_SENTINEL : edge.source();
      String oid = edge.target().equals(endId) ? GraphIndex.END_SENTINEL : edge.target();
      String formatter = fullGraph.formatter(edge.source(), edge.target()).orElse(null);
      edges.add(new FlowEdge(iid, oid, formatter));
    }

    new ConstantEdgeInserter().insert(edges, index.constantEdges());

    List<PlanNode> resources = new ArrayList<>();
    for (Node resource : index.resources()) {
      resource.toPlanNode().ifPresent(resources::add);
    }
    return new Plan(nodes, edges, resources);
  }

  private static JsonNode parse(String rawJson) {
    if (rawJson == null) {
      throw new SerializationException("Canvas JSON must not be null");
    }
    return JacksonUtility.readTree(rawJson);
  }
}
