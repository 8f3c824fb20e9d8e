package com.architecture.memory.flowgraph.service.translation.handler;

import com.architecture.memory.flowgraph.model.graph.FlowNode;
import com.architecture.memory.flowgraph.model.graph.FlowPort;
import com.architecture.memory.flowgraph.model.graph.PortType;
import com.architecture.memory.flowgraph.service.translation.ConstructMatch;
import com.architecture.memory.flowgraph.service.translation.TranslationContext;
import com.architecture.memory.flowgraph.service.translation.VisualScriptingCatalog;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SwitchHandlerTest {

    private static final String BODY = String.join("\n",
            "{",
            "    switch (state)",
            "    {",
            "        case 0: Idle(); break;",
            "        case 1: { Walk(); } break;",
            "        case 2: break;",
            "        default: break;",
            "    }",
            "    case 9: Unreachable();",
            "}");

    private final SwitchHandler handler = new SwitchHandler();

    @Test
    void countsIntegerCasesInsideSwitchBodyOnly() {
        List<ConstructMatch> matches = handler.recognize(BODY);

        assertThat(matches).hasSize(1);
        assertThat(matches.get(0).capture(SwitchHandler.CASE_COUNT)).contains("3");
        assertThat(matches.get(0).capture("selector")).contains("state");
    }

    @Test
    void emitsOneControlOutputPerCasePlusDefault() {
        TranslationContext context = HandlerTestSupport.emitAll(handler, BODY);

        assertThat(context.getFragment().getNodes()).hasSize(1);
        FlowNode switchNode = context.getFragment().getNodes().get(0);
        assertThat(switchNode.getUnitType()).isEqualTo(VisualScriptingCatalog.SWITCH_ON_INTEGER);
        assertThat(switchNode.getPorts())
                .filteredOn(port -> port.getPortType() == PortType.CONTROL_OUTPUT)
                .extracting(FlowPort::getName)
                .containsExactly("0", "1", "2", "default");
        assertThat(context.getFragment().getConnections()).isEmpty();
    }

    @Test
    void ignoresNonIntegerLabels() {
        assertThat(SwitchHandler.countIntegerCases("{ case State.Idle: break; case \"a\": break; case 4 : break; }"))
                .isEqualTo(1);
    }

    @Test
    void countsNoCases_whenSwitchBodyNeverCloses() {
        List<ConstructMatch> matches = handler.recognize("{ switch (mode) { case 0: break;");

        assertThat(matches).hasSize(1);
        assertThat(matches.get(0).capture(SwitchHandler.CASE_COUNT)).contains("0");
    }
}
