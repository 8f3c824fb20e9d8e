package com.architecture.memory.flowgraph.service.serialization;

import com.architecture.memory.flowgraph.dto.document.ConnectionElement;
import com.architecture.memory.flowgraph.dto.document.EmbeddedGraph;
import com.architecture.memory.flowgraph.dto.document.GraphDocument;
import com.architecture.memory.flowgraph.dto.document.GraphElement;
import com.architecture.memory.flowgraph.dto.document.MemberElement;
import com.architecture.memory.flowgraph.dto.document.NestDefinition;
import com.architecture.memory.flowgraph.dto.document.PointValue;
import com.architecture.memory.flowgraph.dto.document.SchemaVersion;
import com.architecture.memory.flowgraph.dto.document.UnitElement;
import com.architecture.memory.flowgraph.dto.document.UnitReference;
import com.architecture.memory.flowgraph.dto.document.VariableCollection;
import com.architecture.memory.flowgraph.dto.document.VariableDeclarations;
import com.architecture.memory.flowgraph.dto.document.VariableElement;
import com.architecture.memory.flowgraph.exception.ConversionException;
import com.architecture.memory.flowgraph.model.graph.FlowConnection;
import com.architecture.memory.flowgraph.model.graph.FlowGraph;
import com.architecture.memory.flowgraph.model.graph.FlowNode;
import com.architecture.memory.flowgraph.model.graph.GraphVariable;
import com.architecture.memory.flowgraph.model.graph.MemberDescriptor;
import com.architecture.memory.flowgraph.model.graph.Position;
import com.architecture.memory.flowgraph.service.translation.VisualScriptingCatalog;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Projects an assembled {@link FlowGraph} into the embedded script graph document and writes it as
 * pretty-printed JSON. No file I/O and no asset envelope: the caller embeds the text.
 */
@Service
@Slf4j
public class GraphSerializer {

    private static final String TYPE_KEY = "type";
    private static final String VALUE_KEY = "value";

    private final ObjectWriter writer;

    public GraphSerializer(ObjectMapper objectMapper) {
        this.writer = objectMapper.writer(new GraphPrettyPrinter());
    }

    public String serialize(FlowGraph graph) {
        GraphDocument document = toDocument(graph);
        try {
            String json = writer.writeValueAsString(document);
            log.debug("[serializer] Graph '{}' written: {} chars", graph.getTitle(), json.length());
            return json;
        } catch (JsonProcessingException e) {
            throw new ConversionException("Failed to serialize graph '" + graph.getTitle() + "'", e);
        }
    }

    public GraphDocument toDocument(FlowGraph graph) {
        List<GraphElement> elements = new ArrayList<>();
        graph.getNodes().forEach(node -> elements.add(toUnit(node)));
        graph.getConnections().forEach(connection -> elements.add(toConnection(connection, graph)));

        EmbeddedGraph embed = EmbeddedGraph.builder()
                .variables(VariableDeclarations.builder()
                        .collection(VariableCollection.builder()
                                .content(toVariables(graph.getVariables()))
                                .build())
                        .build())
                .title(graph.getTitle())
                .summary(graph.getSummary())
                .pan(new PointValue(0.0, 0.0))
                .zoom(FlowGraph.DEFAULT_ZOOM)
                .elements(elements)
                .build();

        return GraphDocument.builder()
                .nest(NestDefinition.builder().embed(embed).build())
                .build();
    }

    // ========================= UNITS =========================

    private UnitElement toUnit(FlowNode node) {
        UnitElement.UnitElementBuilder unit = UnitElement.builder()
                .guid(node.getGuid())
                .unitType(node.getUnitType())
                .id(String.valueOf(node.getDisplayId()))
                .position(toPoint(node.getPosition()))
                .defaultValues(new LinkedHashMap<>(node.getDefaultValues()))
                .summary(node.getDescription());

        MemberDescriptor member = node.getMember();
        if (member != null) {
            List<String> parameterNames = member.getParameterNames() != null
                    ? member.getParameterNames()
                    : new ArrayList<>();
            unit.member(toMember(member))
                    .chainable(false)
                    .parameterNames(parameterNames);
        }

        if (VisualScriptingCatalog.LITERAL.equals(node.getUnitType())
                && node.getDefaultValues().containsKey(TYPE_KEY)) {
            unit.literalType(String.valueOf(node.getDefaultValues().get(TYPE_KEY)))
                    .literalValue(node.getDefaultValues().getOrDefault(VALUE_KEY, emptyValue()));
        }
        return unit.build();
    }

    private MemberElement toMember(MemberDescriptor member) {
        return MemberElement.builder()
                .name(member.getName())
                .parameterTypes(new ArrayList<>(member.getParameterTypes()))
                .targetType(member.getTargetType())
                .targetTypeName(member.getTargetType())
                .parameterNames(member.getParameterNames())
                .build();
    }

    private Map<String, Object> emptyValue() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("$content", null);
        value.put("$type", VisualScriptingCatalog.SYSTEM_OBJECT);
        return value;
    }

    // ========================= CONNECTIONS =========================

    private ConnectionElement toConnection(FlowConnection connection, FlowGraph graph) {
        return ConnectionElement.builder()
                .guid(connection.getGuid())
                .connectionType(connection.isControl()
                        ? VisualScriptingCatalog.CONTROL_CONNECTION
                        : VisualScriptingCatalog.VALUE_CONNECTION)
                .sourceUnit(referenceTo(graph, connection.getSourceIndex()))
                .sourceKey(connection.getSourceKey())
                .destinationUnit(referenceTo(graph, connection.getDestinationIndex()))
                .destinationKey(connection.getDestinationKey())
                .build();
    }

    private UnitReference referenceTo(FlowGraph graph, int index) {
        FlowNode node = graph.findNode(index)
                .orElseThrow(() -> new ConversionException("Connection refers to missing unit slot " + index));
        return new UnitReference(String.valueOf(node.getDisplayId()));
    }

    // ========================= VARIABLES =========================

    private List<VariableElement> toVariables(List<GraphVariable> variables) {
        List<VariableElement> elements = new ArrayList<>();
        for (GraphVariable variable : variables) {
            String type = VisualScriptingCatalog.mapType(variable.getVariableType());

            Map<String, Object> value = new LinkedHashMap<>();
            value.put("$content", variable.getDefaultValue());
            value.put("$type", type);

            Map<String, Object> typeHandle = new LinkedHashMap<>();
            typeHandle.put("Identification", type);
            typeHandle.put("$version", SchemaVersion.CURRENT);

            elements.add(VariableElement.builder()
                    .name(variable.getName())
                    .value(value)
                    .typeHandle(typeHandle)
                    .build());
        }
        return elements;
    }

    private PointValue toPoint(Position position) {
        if (position == null) {
            return new PointValue(0.0, 0.0);
        }
        return new PointValue(position.getX(), position.getY());
    }
}
