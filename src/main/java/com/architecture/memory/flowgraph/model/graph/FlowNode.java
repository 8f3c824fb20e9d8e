package com.architecture.memory.flowgraph.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A unit of the flow graph.
 *
 * Nodes live in an arena: {@code index} is the node's slot in the owning fragment or graph and is
 * the only thing connections refer to. {@code displayId} and {@code guid} are assigned once the node
 * is assembled into a graph.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlowNode {

    @Builder.Default
    private int index = -1;

    private int displayId;          // Serialized as $id, arena index + 1
    private String guid;
    private String unitType;        // Fully-qualified unit kind, e.g. Unity.VisualScripting.If
    private Position position;
    private NodeCategory category;

    @Builder.Default
    private List<FlowPort> ports = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> defaultValues = new LinkedHashMap<>();

    private MemberDescriptor member;
    private String description;

    public Optional<FlowPort> findPort(String name) {
        return ports.stream()
                .filter(port -> port.getName().equals(name))
                .findFirst();
    }

    /**
     * Connection key for the named port, or the name itself when the unit declares no such port.
     */
    public String keyOf(String portName) {
        return findPort(portName).map(FlowPort::getKey).orElse(portName);
    }

    public boolean hasPortKey(String key) {
        return ports.stream().anyMatch(port -> port.getKey().equals(key));
    }

    public boolean hasControlPorts() {
        return ports.stream().anyMatch(port -> port.getPortType().isControl());
    }
}
