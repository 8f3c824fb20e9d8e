package com.architecture.memory.flowgraph.service.graph;

import com.architecture.memory.flowgraph.config.ConverterProperties;
import com.architecture.memory.flowgraph.model.graph.FlowConnection;
import com.architecture.memory.flowgraph.model.graph.FlowGraph;
import com.architecture.memory.flowgraph.model.graph.FlowNode;
import com.architecture.memory.flowgraph.service.translation.MethodFragment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Merges per-method fragments into one flow graph.
 *
 * Fragments are appended in method order. Node slots are rebased into a single arena, each node gets
 * its layout position and display id from its arena slot, and connections are rebased to match.
 * Positions come from emission order only, never from graph topology.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GraphAssembler {

    private final ConverterProperties properties;
    private final IdentifierSource identifierSource;

    public FlowGraph assemble(String className, String fileName, List<MethodFragment> fragments) {
        FlowGraph graph = FlowGraph.builder()
                .title(className != null ? className : properties.getFallbackTitle())
                .summary(summaryFor(className, fileName))
                .build();

        LayoutCursor layout = new LayoutCursor(properties.getLayout());
        int dropped = 0;

        for (MethodFragment fragment : fragments) {
            int offset = graph.getNodes().size();

            for (FlowNode node : fragment.getNodes()) {
                int index = graph.getNodes().size();
                node.setIndex(index);
                node.setDisplayId(index + 1);
                node.setGuid(identifierSource.nextGuid());
                node.setPosition(layout.next());
                graph.getNodes().add(node);
            }

            for (FlowConnection connection : fragment.getConnections()) {
                FlowConnection rebased = connection.rebase(offset);
                if (!withinFragment(rebased.getSourceIndex(), offset, graph)
                        || !withinFragment(rebased.getDestinationIndex(), offset, graph)) {
                    log.warn("[assembler] Dropping dangling connection {} -> {} in method {}",
                            rebased.getSourceKey(), rebased.getDestinationKey(), fragment.getMethodName());
                    dropped++;
                    continue;
                }
                rebased.setGuid(identifierSource.nextGuid());
                graph.getConnections().add(rebased);
            }
        }

        log.info("[assembler] Graph '{}' assembled: methods={} nodes={} connections={} dropped={}",
                graph.getTitle(), fragments.size(), graph.getNodes().size(), graph.getConnections().size(), dropped);
        return graph;
    }

    // A fragment may only wire its own units
    private boolean withinFragment(int index, int offset, FlowGraph graph) {
        return index >= offset && graph.findNode(index).isPresent();
    }

    /**
     * Graph summary naming the originating file, or the class's conventional file name.
     */
    static String summaryFor(String className, String fileName) {
        if (fileName != null && !fileName.isBlank()) {
            return "Converted from " + fileName;
        }
        if (className != null) {
            return "Converted from " + className + ".cs";
        }
        return "Converted Graph";
    }
}
