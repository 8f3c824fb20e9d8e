package com.architecture.memory.flowgraph.service.translation.handler;

import com.architecture.memory.flowgraph.model.graph.FlowConnection;
import com.architecture.memory.flowgraph.model.graph.FlowNode;
import com.architecture.memory.flowgraph.service.translation.TranslationContext;
import com.architecture.memory.flowgraph.service.translation.VisualScriptingCatalog;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DebugLogHandlerTest {

    private final DebugLogHandler handler = new DebugLogHandler();

    @Test
    void wiresStringLiteralIntoMessageInput() {
        TranslationContext context = HandlerTestSupport.emitAll(handler, "{ Debug.Log(\"Player died!\"); }");

        FlowNode invoke = context.getFragment().getNodes().get(0);
        FlowNode literal = context.getFragment().getNodes().get(1);
        assertThat(invoke.getUnitType()).isEqualTo(VisualScriptingCatalog.INVOKE_MEMBER);
        assertThat(invoke.getMember().getTargetType()).isEqualTo("UnityEngine.Debug");
        assertThat(invoke.getMember().isStatic()).isTrue();
        assertThat(invoke.hasPortKey("%message")).isTrue();
        assertThat(literal.getDefaultValues()).containsEntry("type", VisualScriptingCatalog.SYSTEM_STRING);
        assertThat(literal.getDefaultValues().get("value"))
                .isEqualTo(Map.of("$content", "Player died!", "$type", VisualScriptingCatalog.SYSTEM_STRING));

        FlowConnection message = context.getFragment().getConnections().get(0);
        assertThat(message.getSourceIndex()).isEqualTo(1);
        assertThat(message.getSourceKey()).isEqualTo("output");
        assertThat(message.getDestinationIndex()).isEqualTo(0);
        assertThat(message.getDestinationKey()).isEqualTo("%message");
    }

    @Test
    void leavesMessageUnwired_forNonLiteralArgument() {
        TranslationContext context = HandlerTestSupport.emitAll(handler, "{ Debug.Log(score); }");

        assertThat(context.getFragment().getNodes()).hasSize(1);
        assertThat(context.getFragment().getConnections()).isEmpty();
    }

    @Test
    void recognizesStringLiteralsOnly() {
        assertThat(DebugLogHandler.stringLiteral("\"hi\"")).contains("hi");
        assertThat(DebugLogHandler.stringLiteral("\"\"")).contains("");
        assertThat(DebugLogHandler.stringLiteral("\"")).isEmpty();
        assertThat(DebugLogHandler.stringLiteral("name")).isEmpty();
    }
}
