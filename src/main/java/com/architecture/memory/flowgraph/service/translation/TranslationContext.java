package com.architecture.memory.flowgraph.service.translation;

import com.architecture.memory.flowgraph.model.graph.FlowConnection;
import com.architecture.memory.flowgraph.model.graph.FlowNode;
import com.architecture.memory.flowgraph.service.extraction.ParsedMethod;
import lombok.Getter;

/**
 * Per-method translation state: the fragment being filled and the control cursor threaded
 * through every construct category.
 */
@Getter
public class TranslationContext {

    private final ParsedMethod method;
    private final MethodFragment fragment;
    private final ControlCursor cursor;
    private final UnitFactory units;

    public TranslationContext(ParsedMethod method, UnitFactory units) {
        this(method, units, new ControlCursor());
    }

    public TranslationContext(ParsedMethod method, UnitFactory units, ControlCursor cursor) {
        this.method = method;
        this.units = units;
        this.cursor = cursor;
        this.fragment = MethodFragment.builder().methodName(method.getName()).build();
    }

    /**
     * Place a unit in the fragment arena.
     */
    public FlowNode add(FlowNode node) {
        node.setIndex(fragment.getNodes().size());
        fragment.getNodes().add(node);
        return node;
    }

    /**
     * Wire the cursor unit into {@code node}'s enter port, then move the cursor to {@code node}.
     * Without a cursor unit only the cursor moves.
     */
    public void enterControl(FlowNode node) {
        cursor.current().ifPresent(previous -> fragment.getConnections().add(FlowConnection.builder()
                .sourceIndex(previous.getIndex())
                .sourceKey(cursor.exitKey())
                .destinationIndex(node.getIndex())
                .destinationKey(node.keyOf(UnitFactory.ENTER))
                .control(true)
                .build()));
        cursor.moveTo(node);
    }

    public void connectValue(FlowNode source, String sourcePort, FlowNode destination, String destinationPort) {
        fragment.getConnections().add(FlowConnection.builder()
                .sourceIndex(source.getIndex())
                .sourceKey(source.keyOf(sourcePort))
                .destinationIndex(destination.getIndex())
                .destinationKey(destination.keyOf(destinationPort))
                .control(false)
                .build());
    }
}
