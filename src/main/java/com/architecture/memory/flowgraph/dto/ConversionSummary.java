package com.architecture.memory.flowgraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Statistics of one conversion, without the graph document itself.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversionSummary {
    private String className;
    private String title;
    private int methodCount;
    private int eventCount;
    private int nodeCount;
    private int connectionCount;

    @Builder.Default
    private Map<String, Long> nodesByCategory = new LinkedHashMap<>();
}
