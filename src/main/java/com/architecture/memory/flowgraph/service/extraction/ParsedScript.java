package com.architecture.memory.flowgraph.service.extraction;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Declarations recovered from one C# script. Anything the patterns do not recognize is simply absent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParsedScript {

    @Builder.Default
    private List<String> usings = new ArrayList<>();

    private String namespace;
    private String className;
    private String baseClass;

    @Builder.Default
    private List<ParsedField> fields = new ArrayList<>();

    @Builder.Default
    private List<ParsedMethod> methods = new ArrayList<>();

    public Optional<String> findClassName() {
        return Optional.ofNullable(className);
    }

    public Optional<String> findNamespace() {
        return Optional.ofNullable(namespace);
    }
}
