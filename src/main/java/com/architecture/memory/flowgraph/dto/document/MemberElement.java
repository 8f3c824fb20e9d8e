package com.architecture.memory.flowgraph.dto.document;

import com.fasterxml.jackson.annotation.JsonInclude;
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
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "parameterTypes", "targetType", "targetTypeName", "parameterNames", "$version"})
public class MemberElement {

    private String name;

    @Builder.Default
    private List<String> parameterTypes = new ArrayList<>();

    private String targetType;
    private String targetTypeName;
    private List<String> parameterNames;

    @JsonProperty("$version")
    @Builder.Default
    private String version = SchemaVersion.CURRENT;
}
