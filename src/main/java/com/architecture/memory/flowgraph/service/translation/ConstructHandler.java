package com.architecture.memory.flowgraph.service.translation;

import java.util.List;

/**
 * Recognizes one construct category in a method body and synthesizes its units.
 *
 * Recognition and emission are separate so the translator can sequence matches either by category
 * or by source position.
 */
public interface ConstructHandler {

    ConstructCategory category();

    /**
     * All occurrences of this construct in textual order. An empty list is the normal outcome for
     * bodies that do not use the construct.
     */
    List<ConstructMatch> recognize(String body);

    /**
     * Add the units for one occurrence to the context and wire them to the control cursor.
     */
    void emit(ConstructMatch match, TranslationContext context);
}
