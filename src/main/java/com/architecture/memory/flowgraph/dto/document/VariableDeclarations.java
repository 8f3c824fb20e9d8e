package com.architecture.memory.flowgraph.dto.document;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"Kind", "collection", "$version"})
public class VariableDeclarations {

    @JsonProperty("Kind")
    @Builder.Default
    private String kind = "Flow";

    private VariableCollection collection;

    @JsonProperty("$version")
    @Builder.Default
    private String version = SchemaVersion.CURRENT;
}
