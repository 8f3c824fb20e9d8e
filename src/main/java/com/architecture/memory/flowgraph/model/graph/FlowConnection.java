package com.architecture.memory.flowgraph.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A control or value edge between two units, addressed by arena index.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlowConnection {

    private String guid;
    private int sourceIndex;
    private String sourceKey;
    private int destinationIndex;
    private String destinationKey;
    private boolean control;

    /**
     * Copy of this connection with both endpoints shifted by {@code offset} arena slots.
     */
    public FlowConnection rebase(int offset) {
        return FlowConnection.builder()
                .guid(guid)
                .sourceIndex(sourceIndex + offset)
                .sourceKey(sourceKey)
                .destinationIndex(destinationIndex + offset)
                .destinationKey(destinationKey)
                .control(control)
                .build();
    }
}
