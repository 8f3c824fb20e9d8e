package com.architecture.memory.flowgraph.service.translation;

import com.architecture.memory.flowgraph.model.graph.FlowConnection;
import com.architecture.memory.flowgraph.model.graph.FlowNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Units and connections synthesized for one method. Indices are local to the fragment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MethodFragment {
    private String methodName;

    @Builder.Default
    private List<FlowNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<FlowConnection> connections = new ArrayList<>();

    // Event unit of a lifecycle method, always nodes[0] when present
    private FlowNode eventNode;

    public Optional<FlowNode> findEventNode() {
        return Optional.ofNullable(eventNode);
    }
}
