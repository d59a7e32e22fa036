package com.gentoro.flowplan.node;

import static com.gentoro.flowplan.Canvas.data;
import static com.gentoro.flowplan.Canvas.node;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.flowplan.Canvas;
import com.gentoro.flowplan.converter.ConverterSettings;
import com.gentoro.flowplan.exception.NotFoundException;
import com.gentoro.flowplan.plan.PlanNode;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ReferenceResolverNodesTest {

  @Mock private ReferenceResolver resolver;

  private DefaultNodeFactory factory;

  @BeforeEach
  void setUp() {
    factory = new DefaultNodeFactory(resolver, ConverterSettings.defaults());
  }

  @Test
  @DisplayName("Sub-canvas graphs that are not embedded come from the resolver")
  void subgraphFromResolver() {
    when(resolver.subgraph("stored-app")).thenReturn(Optional.of(Canvas.linear("x").json()));
    ObjectNode raw = node("sub", "App");
    data(raw).put("payload__patent_id", "stored-app");

    PlanNode node = factory.create(raw).toPlanNode().orElseThrow();

    assertEquals("stored-app-x", node.subPlan().orElseThrow().nodes().get(0).id());
    verify(resolver).subgraph("stored-app");
  }

  @Test
  @DisplayName("A sub-canvas nobody can provide is NOT_FOUND")
  void subgraphMissing() {
    when(resolver.subgraph("gone")).thenReturn(Optional.empty());
    ObjectNode raw = node("sub", "SubGraph");
    data(raw).put("payload__patent_id", "gone");

    NotFoundException ex = assertThrows(NotFoundException.class, () -> factory.create(raw));
    assertEquals("gone", ex.getContext().get("appId"));
  }

  @Test
  @DisplayName("Template canvases are emitted as SubGraph")
  void templateKind() {
    ObjectNode raw = node("tpl", "template");
    data(raw).put("payload__patent_id", "t");
    data(raw).set("config__patent_graph", Canvas.linear("y").json());

    PlanNode node = factory.create(raw).toPlanNode().orElseThrow();

    assertEquals("SubGraph", node.kind());
    verifyNoInteractions(resolver);
  }

  @Test
  @DisplayName("Model credentials are merged into the model node's args")
  void modelCredentials() {
    when(resolver.modelCredentials("m-1")).thenReturn(Map.of("api_key", "k", "secret_key", "s"));
    ObjectNode raw = node("llm", "OnlineLLM");
    data(raw).put("payload__base_model", "base");
    data(raw).put("payload__model_id", "m-1");

    PlanNode node = factory.create(raw).toPlanNode().orElseThrow();

    assertEquals("LLM", node.kind());
    assertEquals("k", node.args().get("api_key").asText());
    assertEquals("s", node.args().get("secret_key").asText());
    assertEquals(4096, node.hyperparameter().get("max_new_tokens").intValue());
    assertEquals(0.8, node.hyperparameter().get("temperature").doubleValue(), 1e-9);
  }

  @Test
  @DisplayName("API-mode HTTP tools take their binding from the resolver")
  void httpToolBinding() {
    when(resolver.toolBinding("abc"))
        .thenReturn(Optional.of(new ReferenceResolver.ToolBinding("api-7", "oauth", true)));
    when(resolver.currentUserId()).thenReturn(Optional.of("user-1"));
    ObjectNode raw = node("a-b-c", "HttpTool");
    data(raw).put("payload__url", "https://example.com");
    data(raw).put("payload__api_key", "secret");

    PlanNode node = factory.create(raw).toPlanNode().orElseThrow();

    assertEquals("Funcabc", node.extra("provider_name").orElseThrow().asText());
    assertEquals("api-7", node.args().get("tool_api_id").asText());
    assertEquals("oauth", node.args().get("authentication_type").asText());
    assertTrue(node.args().get("share_key").booleanValue());
    assertEquals("user-1", node.args().get("user_id").asText());
    assertEquals("Bearer secret", node.args().get("headers").get("Authorization").asText());
  }

  @Test
  @DisplayName("Code-mode HTTP tools need no resolver")
  void httpToolCodeMode() {
    ObjectNode raw = node("tool", "httptool");
    data(raw).put("payload__code_str", "def call(): pass");

    PlanNode node = factory.create(raw).toPlanNode().orElseThrow();

    assertEquals("def call(): pass", node.args().get("code_str").asText());
    assertFalse(node.args().has("url"));
    verifyNoInteractions(resolver);
  }
}
