package com.architecture.memory.flowgraph.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Unified flow graph document assembled from every translated method.
 * Nodes are stored in an indexed arena; connections refer to nodes by arena index.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlowGraph {

    public static final double DEFAULT_ZOOM = 1.0;

    private String title;
    private String summary;

    @Builder.Default
    private List<FlowNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<FlowConnection> connections = new ArrayList<>();

    @Builder.Default
    private List<GraphVariable> variables = new ArrayList<>();

    public Optional<FlowNode> findNode(int index) {
        if (index < 0 || index >= nodes.size()) {
            return Optional.empty();
        }
        return Optional.of(nodes.get(index));
    }

    public List<FlowNode> nodesOf(NodeCategory category) {
        return nodes.stream()
                .filter(node -> node.getCategory() == category)
                .collect(Collectors.toList());
    }

    public Map<NodeCategory, Long> countByCategory() {
        return nodes.stream()
                .collect(Collectors.groupingBy(FlowNode::getCategory, Collectors.counting()));
    }

    public List<FlowConnection> incomingConnections(FlowNode node) {
        return connections.stream()
                .filter(connection -> connection.getDestinationIndex() == node.getIndex())
                .collect(Collectors.toList());
    }
}
