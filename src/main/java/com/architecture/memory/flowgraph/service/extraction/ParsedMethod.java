package com.architecture.memory.flowgraph.service.extraction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A method declaration as recovered from source text, body kept as raw text.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParsedMethod {
    private String access;
    private boolean isStatic;
    private String modifier;        // virtual, override, abstract or null
    private boolean async;
    private String returnType;
    private String name;

    @Builder.Default
    private List<ParsedParameter> parameters = new ArrayList<>();

    // Exact span from the opening to the closing brace, empty when the body never closes
    private String body;

    // Return type denotes an iterator (IEnumerator), i.e. a coroutine
    private boolean coroutine;

    // Leading comment text, empty when none
    private String comments;

    // Offset of the declaration match in the source
    private int offset;
}
