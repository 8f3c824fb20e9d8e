package com.architecture.memory.flowgraph.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Reflected member an invoke unit is bound to.
 *
 * Example: Debug.Log(message)
 *   - name = "Log"
 *   - targetType = "UnityEngine.Debug"
 *   - parameterTypes = ["System.Object"]
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemberDescriptor {
    private String name;
    private String targetType;

    @Builder.Default
    private List<String> parameterTypes = new ArrayList<>();

    // Null when the member is bound without declared parameter names
    private List<String> parameterNames;

    private boolean isStatic;
}
