package com.architecture.memory.flowgraph.service.extraction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A field declaration as recovered from source text.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParsedField {
    private String access;          // public, private, protected, internal; defaults to private
    private boolean isStatic;
    private boolean readonly;
    private String type;
    private String name;
    private String initializer;     // Raw initializer text, null when absent
}
