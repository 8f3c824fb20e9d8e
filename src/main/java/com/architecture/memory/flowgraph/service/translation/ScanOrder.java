package com.architecture.memory.flowgraph.service.translation;

/**
 * How the constructs of one method body are sequenced on the control cursor.
 */
public enum ScanOrder {

    /**
     * Every match of one construct category before any match of the next, categories in
     * {@link ConstructCategory} order. Textually interleaved constructs are regrouped.
     */
    CATEGORY,

    /**
     * All recognized constructs in the order they appear in the source.
     */
    TEXTUAL
}
