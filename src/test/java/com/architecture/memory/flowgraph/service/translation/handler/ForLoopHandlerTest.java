package com.architecture.memory.flowgraph.service.translation.handler;

import com.architecture.memory.flowgraph.model.graph.FlowConnection;
import com.architecture.memory.flowgraph.model.graph.FlowNode;
import com.architecture.memory.flowgraph.service.translation.ConstructMatch;
import com.architecture.memory.flowgraph.service.translation.TranslationContext;
import com.architecture.memory.flowgraph.service.translation.VisualScriptingCatalog;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class ForLoopHandlerTest {

    private final ForLoopHandler handler = new ForLoopHandler();

    @Test
    void capturesLoopClauses() {
        List<ConstructMatch> matches = handler.recognize("{ for (int i = 0; i < 5; i++) { Tick(); } }");

        assertThat(matches).hasSize(1);
        ConstructMatch match = matches.get(0);
        assertThat(match.capture("var")).contains("i");
        assertThat(match.capture("start")).contains("0");
        assertThat(match.capture("cmp")).contains("<");
        assertThat(match.capture("end")).contains("5");
        assertThat(match.capture("step")).contains("++");
    }

    @Test
    void emitsLoopFedByBoundLiterals() {
        TranslationContext context = HandlerTestSupport.emitAll(handler, "{ for (int i = 2; i <= 8; i++) { } }");

        List<FlowNode> nodes = context.getFragment().getNodes();
        assertThat(nodes).extracting(FlowNode::getUnitType)
                .containsExactly(VisualScriptingCatalog.FOR, VisualScriptingCatalog.LITERAL, VisualScriptingCatalog.LITERAL);
        assertThat(literalContent(nodes.get(1))).isEqualTo(2);
        assertThat(literalContent(nodes.get(2))).isEqualTo(8);
        assertThat(nodes.get(1).getDefaultValues()).containsEntry("type", VisualScriptingCatalog.SYSTEM_INT32);

        assertThat(context.getFragment().getConnections())
                .extracting(FlowConnection::getSourceIndex, FlowConnection::getSourceKey,
                        FlowConnection::getDestinationIndex, FlowConnection::getDestinationKey, FlowConnection::isControl)
                .containsExactly(
                        tuple(1, "output", 0, "%firstIndex", false),
                        tuple(2, "output", 0, "%lastIndex", false));
    }

    @Test
    void fallsBackToDefaultBounds_whenBoundsAreNotIntegerLiterals() {
        TranslationContext context = HandlerTestSupport.emitAll(handler,
                "{ for (var j = start; j < items.Length; j += 2) { } }");

        List<FlowNode> nodes = context.getFragment().getNodes();
        assertThat(literalContent(nodes.get(1))).isEqualTo(ForLoopHandler.DEFAULT_FIRST_INDEX);
        assertThat(literalContent(nodes.get(2))).isEqualTo(ForLoopHandler.DEFAULT_LAST_INDEX);
    }

    @Test
    void ignoresLoops_whoseClausesUseDifferentVariables() {
        assertThat(handler.recognize("{ for (int i = 0; j < 5; i++) { } }")).isEmpty();
        assertThat(handler.recognize("{ foreach (var item in items) { } }")).isEmpty();
    }

    @Test
    void parsesOnlyPlainIntegers() {
        assertThat(ForLoopHandler.parseBound(" 42 ", 7)).isEqualTo(42);
        assertThat(ForLoopHandler.parseBound("-1", 7)).isEqualTo(7);
        assertThat(ForLoopHandler.parseBound("count", 7)).isEqualTo(7);
        assertThat(ForLoopHandler.parseBound("99999999999", 7)).isEqualTo(7);
    }

    @SuppressWarnings("unchecked")
    private Object literalContent(FlowNode literal) {
        return ((Map<String, Object>) literal.getDefaultValues().get("value")).get("$content");
    }
}
