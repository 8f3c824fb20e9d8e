package com.architecture.memory.flowgraph.service.translation;

/**
 * Recognized statement kinds. Declaration order is the category scan precedence.
 */
public enum ConstructCategory {
    FOR_LOOP,
    WHILE_LOOP,
    FOREACH_LOOP,
    SWITCH,
    DEBUG_LOG,
    CONDITIONAL,
    ASSIGNMENT,
    YIELD_RETURN,
    MEMBER_CALL
}
