package com.architecture.memory.flowgraph.service.conversion;

import com.architecture.memory.flowgraph.dto.ConversionSummary;
import com.architecture.memory.flowgraph.model.graph.FlowGraph;
import com.architecture.memory.flowgraph.model.graph.NodeCategory;
import com.architecture.memory.flowgraph.service.extraction.ParsedScript;
import com.architecture.memory.flowgraph.service.extraction.ScriptSourceExtractor;
import com.architecture.memory.flowgraph.service.graph.GraphAssembler;
import com.architecture.memory.flowgraph.service.serialization.GraphSerializer;
import com.architecture.memory.flowgraph.service.translation.MethodFragment;
import com.architecture.memory.flowgraph.service.translation.StatementTranslator;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Script text to graph JSON: extract, translate per method, assemble, serialize.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversionService {

    private final ScriptSourceExtractor extractor;
    private final StatementTranslator translator;
    private final GraphAssembler assembler;
    private final GraphSerializer serializer;

    public String convert(String source, String fileName) {
        return serializer.serialize(run(source, fileName).getGraph());
    }

    public ConversionSummary summarize(String source, String fileName) {
        Conversion conversion = run(source, fileName);
        FlowGraph graph = conversion.getGraph();

        Map<NodeCategory, Long> counts = graph.countByCategory();
        Map<String, Long> byCategory = new LinkedHashMap<>();
        for (NodeCategory category : NodeCategory.values()) {
            if (counts.containsKey(category)) {
                byCategory.put(category.getValue(), counts.get(category));
            }
        }

        return ConversionSummary.builder()
                .className(conversion.getScript().getClassName())
                .title(graph.getTitle())
                .methodCount(conversion.getScript().getMethods().size())
                .eventCount(graph.nodesOf(NodeCategory.EVENT).size())
                .nodeCount(graph.getNodes().size())
                .connectionCount(graph.getConnections().size())
                .nodesByCategory(byCategory)
                .build();
    }

    public FlowGraph buildGraph(String source, String fileName) {
        return run(source, fileName).getGraph();
    }

    private Conversion run(String source, String fileName) {
        log.info("[conversion] Converting {}", fileName != null ? fileName : "<unnamed script>");
        ParsedScript script = extractor.extract(source);
        List<MethodFragment> fragments = translator.translateAll(script.getMethods());
        FlowGraph graph = assembler.assemble(script.getClassName(), fileName, fragments);
        return new Conversion(script, graph);
    }

    @Value
    private static class Conversion {
        ParsedScript script;
        FlowGraph graph;
    }
}
