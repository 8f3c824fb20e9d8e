package com.architecture.memory.flowgraph.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversionRequest {

    @NotBlank(message = "Script source is required")
    private String source;

    // Used for the graph summary only, e.g. PlayerController.cs
    private String fileName;
}
