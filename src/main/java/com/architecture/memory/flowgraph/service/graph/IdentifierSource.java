package com.architecture.memory.flowgraph.service.graph;

import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Supplies the guid tokens stamped on units and connections.
 */
@FunctionalInterface
public interface IdentifierSource {

    String nextGuid();

    static IdentifierSource random() {
        return () -> UUID.randomUUID().toString();
    }

    /**
     * Deterministic source producing name-based UUIDs from a running counter.
     * Two sequential sources with the same seed yield the same guid sequence.
     */
    static IdentifierSource sequential(String seed) {
        AtomicLong counter = new AtomicLong();
        return () -> UUID.nameUUIDFromBytes((seed + ":" + counter.incrementAndGet()).getBytes(StandardCharsets.UTF_8)).toString();
    }
}
