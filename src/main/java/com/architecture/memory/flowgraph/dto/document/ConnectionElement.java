package com.architecture.memory.flowgraph.dto.document;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"guid", "$type", "sourceUnit", "sourceKey", "destinationUnit", "destinationKey"})
public class ConnectionElement implements GraphElement {

    private String guid;

    @JsonProperty("$type")
    private String connectionType;

    private UnitReference sourceUnit;
    private String sourceKey;
    private UnitReference destinationUnit;
    private String destinationKey;
}
