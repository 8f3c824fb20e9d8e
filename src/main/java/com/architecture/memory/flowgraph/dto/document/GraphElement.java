package com.architecture.memory.flowgraph.dto.document;

/**
 * Entry of the serialized {@code elements} sequence: a unit or a connection.
 */
public interface GraphElement {

    String getGuid();
}
