package com.architecture.memory.flowgraph.service.translation.handler;

import com.architecture.memory.flowgraph.model.graph.FlowNode;
import com.architecture.memory.flowgraph.service.translation.ConstructCategory;
import com.architecture.memory.flowgraph.service.translation.ConstructMatch;
import com.architecture.memory.flowgraph.service.translation.TranslationContext;
import com.architecture.memory.flowgraph.service.translation.UnitFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * {@code Debug.Log(message)} calls. A quoted string argument becomes a string literal wired into the
 * message input; any other argument leaves the input unconnected.
 */
@Component
@Slf4j
public class DebugLogHandler extends AbstractPatternHandler {

    static final String RECEIVER = "Debug";
    static final String METHOD = "Log";

    private static final Pattern DEBUG_LOG_PATTERN = Pattern.compile("\\bDebug\\.Log\\s*\\((?<argument>[^)]+)\\)");

    @Override
    public ConstructCategory category() {
        return ConstructCategory.DEBUG_LOG;
    }

    @Override
    protected Pattern pattern() {
        return DEBUG_LOG_PATTERN;
    }

    @Override
    protected String[] captureNames() {
        return new String[]{"argument"};
    }

    @Override
    public void emit(ConstructMatch match, TranslationContext context) {
        UnitFactory units = context.getUnits();
        String argument = match.captureOrEmpty("argument").trim();

        FlowNode invoke = context.add(units.debugLog());
        context.enterControl(invoke);

        Optional<String> message = stringLiteral(argument);
        message.ifPresent(text -> {
            FlowNode literal = context.add(units.literal(text, "string"));
            context.connectValue(literal, UnitFactory.OUTPUT, invoke, "message");
        });

        log.debug("[translator] Debug.Log({}) literal={}", argument, message.isPresent());
    }

    /**
     * Content of a double-quoted literal, or empty for any other expression.
     */
    static Optional<String> stringLiteral(String argument) {
        if (argument.length() >= 2 && argument.startsWith("\"") && argument.endsWith("\"")) {
            return Optional.of(argument.substring(1, argument.length() - 1));
        }
        return Optional.empty();
    }
}
