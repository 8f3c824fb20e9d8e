package com.architecture.memory.flowgraph.dto.document;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serialized unit. Member and literal keys are only written for the unit kinds that have them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"guid", "$type", "$version", "$id", "position", "defaultValues", "summary", "member",
        "chainable", "parameterNames", "type", "value"})
public class UnitElement implements GraphElement {

    private String guid;

    @JsonProperty("$type")
    private String unitType;

    @JsonProperty("$version")
    @Builder.Default
    private String version = SchemaVersion.CURRENT;

    @JsonProperty("$id")
    private String id;

    private PointValue position;

    @Builder.Default
    private Map<String, Object> defaultValues = new LinkedHashMap<>();

    // Human-readable description, e.g. the comment above a lifecycle method
    private String summary;

    private MemberElement member;
    private Boolean chainable;
    private List<String> parameterNames;

    // Literal units only
    @JsonProperty("type")
    private String literalType;

    @JsonProperty("value")
    private Object literalValue;
}
