package com.architecture.memory.flowgraph.model.graph;

/**
 * Direction and kind of a unit port.
 */
public enum PortType {
    CONTROL_INPUT,
    CONTROL_OUTPUT,
    VALUE_INPUT,
    VALUE_OUTPUT;

    public boolean isControl() {
        return this == CONTROL_INPUT || this == CONTROL_OUTPUT;
    }
}
