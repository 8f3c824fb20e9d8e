package com.architecture.memory.flowgraph.service.graph;

import com.architecture.memory.flowgraph.config.ConverterProperties;
import com.architecture.memory.flowgraph.model.graph.Position;

/**
 * Row-wrapping placement cursor. Positions depend only on how many nodes were placed before.
 */
public class LayoutCursor {

    private final ConverterProperties.Layout layout;
    private double x;
    private double y;

    public LayoutCursor(ConverterProperties.Layout layout) {
        this.layout = layout;
    }

    public Position next() {
        Position position = new Position(x, y);
        x += layout.getColumnStep();
        if (x > layout.getMaxWidth()) {
            x = 0;
            y += layout.getRowHeight();
        }
        return position;
    }
}
