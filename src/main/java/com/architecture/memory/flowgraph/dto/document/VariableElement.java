package com.architecture.memory.flowgraph.dto.document;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A variable declaration entry of the graph's variable collection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"name", "value", "typeHandle", "$version"})
public class VariableElement {

    private String name;
    private Map<String, Object> value;          // {"$content": default, "$type": runtime type}
    private Map<String, Object> typeHandle;     // {"Identification": runtime type, "$version": "A"}

    @JsonProperty("$version")
    @Builder.Default
    private String version = SchemaVersion.CURRENT;
}
