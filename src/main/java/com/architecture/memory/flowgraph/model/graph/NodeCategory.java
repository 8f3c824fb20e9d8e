package com.architecture.memory.flowgraph.model.graph;

/**
 * Coarse classification of a flow graph unit.
 */
public enum NodeCategory {
    EVENT("event"),
    FLOW("flow"),
    DATA("data"),
    INVOKE("invoke"),
    GET_MEMBER("get_member"),
    SET_MEMBER("set_member"),
    VARIABLE("variable"),
    OPERATOR("operator");

    private final String value;

    NodeCategory(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
