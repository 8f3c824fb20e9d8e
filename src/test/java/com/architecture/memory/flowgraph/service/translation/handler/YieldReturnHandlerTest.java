package com.architecture.memory.flowgraph.service.translation.handler;

import com.architecture.memory.flowgraph.model.graph.FlowConnection;
import com.architecture.memory.flowgraph.model.graph.FlowNode;
import com.architecture.memory.flowgraph.service.translation.TranslationContext;
import com.architecture.memory.flowgraph.service.translation.VisualScriptingCatalog;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class YieldReturnHandlerTest {

    private final YieldReturnHandler handler = new YieldReturnHandler();

    @Test
    void addsTimedWait_forNumericWaitForSeconds() {
        TranslationContext context = HandlerTestSupport.emitAll(handler, "{ yield return new WaitForSeconds(1.5f); }");

        List<FlowNode> nodes = context.getFragment().getNodes();
        assertThat(nodes).extracting(FlowNode::getUnitType)
                .containsExactly(VisualScriptingCatalog.YIELD_RETURN, VisualScriptingCatalog.WAIT_FOR_SECONDS);
        assertThat(nodes.get(1).getDefaultValues()).containsEntry("seconds", 1.5f);

        assertThat(context.getFragment().getConnections()).hasSize(1);
        FlowConnection instruction = context.getFragment().getConnections().get(0);
        assertThat(instruction.getSourceIndex()).isEqualTo(1);
        assertThat(instruction.getSourceKey()).isEqualTo("result");
        assertThat(instruction.getDestinationIndex()).isEqualTo(0);
        assertThat(instruction.getDestinationKey()).isEqualTo("%instruction");
        assertThat(instruction.isControl()).isFalse();
    }

    @Test
    void emitsSuspendOnly_forOtherInstructions() {
        TranslationContext context = HandlerTestSupport.emitAll(handler, String.join("\n",
                "{",
                "    yield return null;",
                "    yield return new WaitForSeconds(delay);",
                "    yield return new WaitForEndOfFrame();",
                "}"));

        assertThat(context.getFragment().getNodes())
                .extracting(FlowNode::getUnitType)
                .containsOnly(VisualScriptingCatalog.YIELD_RETURN)
                .hasSize(3);
        assertThat(context.getFragment().getConnections()).hasSize(2);
        assertThat(context.getFragment().getConnections()).allMatch(FlowConnection::isControl);
    }

    @Test
    void parsesCSharpRealLiterals() {
        assertThat(YieldReturnHandler.parseSeconds("2")).contains(2.0f);
        assertThat(YieldReturnHandler.parseSeconds(" 0.25f ")).contains(0.25f);
        assertThat(YieldReturnHandler.parseSeconds("3D")).contains(3.0f);
        assertThat(YieldReturnHandler.parseSeconds("1e-1")).contains(0.1f);
        assertThat(YieldReturnHandler.parseSeconds("delay")).isEmpty();
        assertThat(YieldReturnHandler.parseSeconds("1 + 2")).isEmpty();
        assertThat(YieldReturnHandler.parseSeconds("")).isEmpty();
    }
}
