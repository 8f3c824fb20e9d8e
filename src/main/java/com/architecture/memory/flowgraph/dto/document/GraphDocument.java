package com.architecture.memory.flowgraph.dto.document;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Root of a serialized script graph, the JSON embedded in a Visual Scripting asset.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphDocument {
    private NestDefinition nest;
}
