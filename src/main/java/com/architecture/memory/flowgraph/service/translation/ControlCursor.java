package com.architecture.memory.flowgraph.service.translation;

import com.architecture.memory.flowgraph.model.graph.FlowNode;
import com.architecture.memory.flowgraph.model.graph.NodeCategory;

import java.util.Optional;

/**
 * The unit the next construct's {@code enter} port is wired from.
 * Empty until an event unit or the first construct of a method is emitted.
 */
public class ControlCursor {

    private FlowNode current;

    public Optional<FlowNode> current() {
        return Optional.ofNullable(current);
    }

    /**
     * Port the current unit leaves through: {@code trigger} for events, {@code exit} otherwise.
     */
    public String exitKey() {
        if (current != null && current.getCategory() == NodeCategory.EVENT) {
            return UnitFactory.TRIGGER;
        }
        return UnitFactory.EXIT;
    }

    public void moveTo(FlowNode node) {
        this.current = node;
    }
}
