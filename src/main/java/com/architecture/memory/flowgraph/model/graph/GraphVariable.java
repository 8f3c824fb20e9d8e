package com.architecture.memory.flowgraph.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A graph-scoped variable. No translation rule declares one yet.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphVariable {
    private String name;
    private String variableType;
    private Object defaultValue;
    private boolean exposed;
}
