package com.architecture.memory.flowgraph.dto.document;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"variables", "controlInputDefinitions", "controlOutputDefinitions", "valueInputDefinitions",
        "valueOutputDefinitions", "title", "summary", "pan", "zoom", "elements", "$version"})
public class EmbeddedGraph {

    private VariableDeclarations variables;

    @Builder.Default
    private List<Object> controlInputDefinitions = new ArrayList<>();

    @Builder.Default
    private List<Object> controlOutputDefinitions = new ArrayList<>();

    @Builder.Default
    private List<Object> valueInputDefinitions = new ArrayList<>();

    @Builder.Default
    private List<Object> valueOutputDefinitions = new ArrayList<>();

    private String title;
    private String summary;
    private PointValue pan;
    private double zoom;

    @Builder.Default
    private List<GraphElement> elements = new ArrayList<>();

    @JsonProperty("$version")
    @Builder.Default
    private String version = SchemaVersion.CURRENT;
}
