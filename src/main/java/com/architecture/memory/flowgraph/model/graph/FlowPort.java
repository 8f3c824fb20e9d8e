package com.architecture.memory.flowgraph.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A named attachment point on a unit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlowPort {

    private String name;
    private PortType portType;
    private String dataType;        // e.g. System.Int32, null for control ports
    private Object defaultValue;

    public static FlowPort of(String name, PortType portType) {
        return FlowPort.builder().name(name).portType(portType).build();
    }

    public static FlowPort of(String name, PortType portType, String dataType) {
        return FlowPort.builder().name(name).portType(portType).dataType(dataType).build();
    }

    /**
     * Key used by connections to address this port. Value inputs are prefixed with '%'.
     */
    public String getKey() {
        return portType == PortType.VALUE_INPUT ? "%" + name : name;
    }
}
