package com.architecture.memory.flowgraph.service.translation.handler;

import com.architecture.memory.flowgraph.model.graph.FlowConnection;
import com.architecture.memory.flowgraph.service.translation.ConstructMatch;
import com.architecture.memory.flowgraph.service.translation.TranslationContext;
import com.architecture.memory.flowgraph.service.translation.VisualScriptingCatalog;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class LoopHandlersTest {

    @Test
    void whileLeavesConditionUnwired() {
        TranslationContext context = HandlerTestSupport.emitAll(new WhileLoopHandler(), "{ while (alive) { Tick(); } }");

        assertThat(context.getFragment().getNodes()).singleElement()
                .satisfies(node -> {
                    assertThat(node.getUnitType()).isEqualTo(VisualScriptingCatalog.WHILE);
                    assertThat(node.hasPortKey("%condition")).isTrue();
                });
        assertThat(context.getFragment().getConnections()).isEmpty();
    }

    @Test
    void whileRequiresKeywordBoundary() {
        assertThat(new WhileLoopHandler().recognize("{ awhile(x); }")).isEmpty();
    }

    @Test
    void foreachCapturesTypedAndImplicitItems() {
        ForEachLoopHandler handler = new ForEachLoopHandler();

        List<ConstructMatch> matches = handler.recognize(
                "{ foreach (Enemy enemy in enemies) { } foreach (var pickup in pickups) { } }");

        assertThat(matches).hasSize(2);
        assertThat(matches.get(0).capture("type")).contains("Enemy");
        assertThat(matches.get(0).capture("collection")).contains("enemies");
        assertThat(matches.get(1).capture("type")).isEmpty();
        assertThat(matches.get(1).capture("item")).contains("pickup");
    }

    @Test
    void foreachLoopsAreChainedThroughExit() {
        TranslationContext context = HandlerTestSupport.emitAll(new ForEachLoopHandler(),
                "{ foreach (var a in xs) { } foreach (var b in ys) { } }");

        assertThat(context.getFragment().getNodes())
                .allMatch(node -> VisualScriptingCatalog.FOR_EACH.equals(node.getUnitType()));
        assertThat(context.getFragment().getConnections())
                .extracting(FlowConnection::getSourceKey, FlowConnection::getDestinationKey)
                .containsExactly(tuple("exit", "enter"));
    }
}
