package com.architecture.memory.flowgraph.dto.document;

public final class SchemaVersion {

    public static final String CURRENT = "A";

    private SchemaVersion() {
    }
}
