package com.architecture.memory.flowgraph.service.translation.handler;

import com.architecture.memory.flowgraph.model.graph.FlowNode;
import com.architecture.memory.flowgraph.service.translation.ComparisonOperator;
import com.architecture.memory.flowgraph.service.translation.TranslationContext;
import com.architecture.memory.flowgraph.service.translation.VisualScriptingCatalog;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConditionalHandlerTest {

    private final ConditionalHandler handler = new ConditionalHandler();

    @Test
    void feedsComparisonIntoBranchCondition() {
        TranslationContext context = HandlerTestSupport.emitAll(handler, "{ if (health <= 0) { Die(); } }");

        assertThat(context.getFragment().getNodes()).extracting(FlowNode::getUnitType)
                .containsExactly(VisualScriptingCatalog.IF, ComparisonOperator.LESS_OR_EQUAL.getUnitType());
        assertThat(context.getFragment().getConnections()).singleElement()
                .satisfies(connection -> {
                    assertThat(connection.getSourceKey()).isEqualTo("result");
                    assertThat(connection.getDestinationKey()).isEqualTo("%condition");
                });
    }

    @Test
    void emitsBranchOnly_whenConditionHasNoComparison() {
        TranslationContext context = HandlerTestSupport.emitAll(handler, "{ if (isGrounded) { Jump(); } }");

        assertThat(context.getFragment().getNodes()).hasSize(1);
        assertThat(context.getFragment().getConnections()).isEmpty();
    }

    @Test
    void requiresKeywordBoundary() {
        assertThat(handler.recognize("{ notify(x); elseif(y); }")).isEmpty();
        assertThat(handler.recognize("{ else if(y) { } }")).hasSize(1);
    }

    @Test
    void picksTwoCharacterOperatorsFirst() {
        assertThat(ComparisonOperator.firstIn("a >= b")).contains(ComparisonOperator.GREATER_OR_EQUAL);
        assertThat(ComparisonOperator.firstIn("a != b")).contains(ComparisonOperator.NOT_EQUAL);
        assertThat(ComparisonOperator.firstIn("a > b")).contains(ComparisonOperator.GREATER);
        assertThat(ComparisonOperator.firstIn("flag")).isEmpty();
    }
}
