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
@JsonPropertyOrder({"$content", "$version"})
public class VariableCollection {

    @JsonProperty("$content")
    @Builder.Default
    private List<VariableElement> content = new ArrayList<>();

    @JsonProperty("$version")
    @Builder.Default
    private String version = SchemaVersion.CURRENT;
}
