package com.architecture.memory.flowgraph.config;

import com.architecture.memory.flowgraph.service.translation.ScanOrder;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables of the C# to flow graph conversion, bound from {@code flowgraph.converter.*}.
 */
@Data
@ConfigurationProperties(prefix = "flowgraph.converter")
public class ConverterProperties {

    /**
     * Order in which recognized constructs of a method body are emitted and wired.
     */
    private ScanOrder scanOrder = ScanOrder.CATEGORY;

    /**
     * Number of lines above a method declaration searched for leading comments.
     */
    private int commentWindowLines = 5;

    /**
     * Characters before a member call inspected for an assignment operator.
     */
    private int callLookbehindChars = 20;

    /**
     * Graph title used when no class declaration is recovered.
     */
    private String fallbackTitle = "ConvertedGraph";

    private Layout layout = new Layout();

    @Data
    public static class Layout {
        private double columnStep = 250;
        private double maxWidth = 1000;
        private double rowHeight = 150;
    }
}
