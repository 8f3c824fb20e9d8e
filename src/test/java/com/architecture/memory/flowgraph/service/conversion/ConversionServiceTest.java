package com.architecture.memory.flowgraph.service.conversion;

import com.architecture.memory.flowgraph.config.ConverterProperties;
import com.architecture.memory.flowgraph.dto.ConversionSummary;
import com.architecture.memory.flowgraph.model.graph.FlowGraph;
import com.architecture.memory.flowgraph.model.graph.FlowNode;
import com.architecture.memory.flowgraph.model.graph.NodeCategory;
import com.architecture.memory.flowgraph.service.extraction.ScriptSourceExtractor;
import com.architecture.memory.flowgraph.service.graph.GraphAssembler;
import com.architecture.memory.flowgraph.service.graph.IdentifierSource;
import com.architecture.memory.flowgraph.service.serialization.GraphSerializer;
import com.architecture.memory.flowgraph.service.translation.StatementTranslator;
import com.architecture.memory.flowgraph.service.translation.UnitFactory;
import com.architecture.memory.flowgraph.service.translation.handler.AssignmentHandler;
import com.architecture.memory.flowgraph.service.translation.handler.ConditionalHandler;
import com.architecture.memory.flowgraph.service.translation.handler.DebugLogHandler;
import com.architecture.memory.flowgraph.service.translation.handler.ForEachLoopHandler;
import com.architecture.memory.flowgraph.service.translation.handler.ForLoopHandler;
import com.architecture.memory.flowgraph.service.translation.handler.MemberCallHandler;
import com.architecture.memory.flowgraph.service.translation.handler.SwitchHandler;
import com.architecture.memory.flowgraph.service.translation.handler.WhileLoopHandler;
import com.architecture.memory.flowgraph.service.translation.handler.YieldReturnHandler;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConversionServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private String playerController;

    @BeforeEach
    void setUp() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/scripts/PlayerController.cs")) {
            assertThat(in).isNotNull();
            playerController = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void convertsSamplePlayerController() throws Exception {
        JsonNode embed = objectMapper.readTree(service("sample").convert(playerController, "PlayerController.cs"))
                .at("/nest/embed");

        assertThat(embed.path("title").asText()).isEqualTo("PlayerController");
        assertThat(embed.path("summary").asText()).isEqualTo("Converted from PlayerController.cs");

        JsonNode elements = embed.path("elements");
        assertThat(elements.size()).isEqualTo(14 + 11);
        assertThat(elements.get(0).path("$type").asText()).isEqualTo("Unity.VisualScripting.Start");
        assertThat(elements.get(4).path("$type").asText()).isEqualTo("Unity.VisualScripting.Update");
        assertThat(elements.get(11).path("$type").asText()).isEqualTo("Unity.VisualScripting.OnTriggerEnter");
        assertThat(elements.get(13).path("$type").asText()).isEqualTo("Unity.VisualScripting.Literal");
        assertThat(elements.get(14).has("sourceUnit")).isTrue();
    }

    @Test
    void summarizesSamplePlayerController() {
        ConversionSummary summary = service("summary").summarize(playerController, null);

        Map<String, Long> byCategory = new LinkedHashMap<>();
        byCategory.put("event", 3L);
        byCategory.put("flow", 1L);
        byCategory.put("data", 4L);
        byCategory.put("invoke", 4L);
        byCategory.put("variable", 1L);
        byCategory.put("operator", 1L);

        assertThat(summary.getClassName()).isEqualTo("PlayerController");
        assertThat(summary.getMethodCount()).isEqualTo(3);
        assertThat(summary.getEventCount()).isEqualTo(3);
        assertThat(summary.getNodeCount()).isEqualTo(14);
        assertThat(summary.getConnectionCount()).isEqualTo(11);
        assertThat(summary.getNodesByCategory()).containsExactlyEntriesOf(byCategory);
    }

    @Test
    void everyLifecycleMethodStartsWithItsEvent() {
        FlowGraph graph = service("events").buildGraph(playerController, "PlayerController.cs");

        assertThat(graph.getNodes())
                .extracting(FlowNode::getDisplayId)
                .containsExactlyElementsOf(List.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14));
        assertThat(graph.nodesOf(NodeCategory.EVENT))
                .extracting(FlowNode::getDisplayId)
                .containsExactly(1, 5, 12);
        assertThat(graph.nodesOf(NodeCategory.EVENT))
                .allMatch(event -> graph.incomingConnections(event).isEmpty());
        assertThat(graph.getConnections())
                .allMatch(connection -> graph.findNode(connection.getSourceIndex()).isPresent()
                        && graph.findNode(connection.getDestinationIndex()).isPresent());
    }

    @Test
    void producesIdenticalOutput_forSameInputAndIdentifierSeed() {
        String first = service("repeat").convert(playerController, "PlayerController.cs");
        String second = service("repeat").convert(playerController, "PlayerController.cs");

        assertThat(first).isEqualTo(second);
    }

    @Test
    void convertsTextWithoutDeclarations_toEmptyGraph() throws Exception {
        JsonNode embed = objectMapper.readTree(service("empty").convert("not a script", null)).at("/nest/embed");

        assertThat(embed.path("title").asText()).isEqualTo("ConvertedGraph");
        assertThat(embed.path("summary").asText()).isEqualTo("Converted Graph");
        assertThat(embed.path("elements").size()).isZero();
    }

    private ConversionService service(String seed) {
        ConverterProperties properties = new ConverterProperties();
        StatementTranslator translator = new StatementTranslator(List.of(
                new ForLoopHandler(),
                new WhileLoopHandler(),
                new ForEachLoopHandler(),
                new SwitchHandler(),
                new DebugLogHandler(),
                new ConditionalHandler(),
                new AssignmentHandler(),
                new YieldReturnHandler(),
                new MemberCallHandler(properties)), new UnitFactory(), properties);

        return new ConversionService(
                new ScriptSourceExtractor(properties),
                translator,
                new GraphAssembler(properties, IdentifierSource.sequential(seed)),
                new GraphSerializer(objectMapper));
    }
}
