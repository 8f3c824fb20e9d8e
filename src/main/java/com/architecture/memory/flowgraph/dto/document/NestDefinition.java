package com.architecture.memory.flowgraph.dto.document;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"source", "macro", "embed"})
public class NestDefinition {

    public static final String EMBED = "Embed";

    @Builder.Default
    private String source = EMBED;

    // Embedded graphs reference no macro asset; the key is written as null
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private Object macro;

    private EmbeddedGraph embed;
}
