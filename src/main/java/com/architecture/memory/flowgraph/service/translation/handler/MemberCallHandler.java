package com.architecture.memory.flowgraph.service.translation.handler;

import com.architecture.memory.flowgraph.config.ConverterProperties;
import com.architecture.memory.flowgraph.model.graph.FlowNode;
import com.architecture.memory.flowgraph.service.extraction.ParsedParameter;
import com.architecture.memory.flowgraph.service.translation.ConstructCategory;
import com.architecture.memory.flowgraph.service.translation.ConstructMatch;
import com.architecture.memory.flowgraph.service.translation.TranslationContext;
import com.architecture.memory.flowgraph.service.translation.VisualScriptingCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Generic {@code receiver.method(args)} calls, bound to a member descriptor synthesized from the call
 * site. Only the argument count is recovered; every argument becomes an untyped {@code argN} input.
 *
 * Skipped: {@code Debug.Log}, which has its own handler, and calls whose line shows an assignment
 * operator shortly before the call (the right-hand side of an assignment).
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MemberCallHandler extends AbstractPatternHandler {

    private static final Pattern CALL_PATTERN = Pattern.compile(
            "(?<receiver>\\w+)\\.(?<method>\\w+)\\s*\\((?<args>[^)]*)\\)");

    private final ConverterProperties properties;

    @Override
    public ConstructCategory category() {
        return ConstructCategory.MEMBER_CALL;
    }

    @Override
    protected Pattern pattern() {
        return CALL_PATTERN;
    }

    @Override
    protected String[] captureNames() {
        return new String[]{"receiver", "method", "args"};
    }

    @Override
    protected boolean accept(ConstructMatch match, String body) {
        if (DebugLogHandler.RECEIVER.equals(match.captureOrEmpty("receiver"))
                && DebugLogHandler.METHOD.equals(match.captureOrEmpty("method"))) {
            return false;
        }
        return !followsAssignment(body, match.getOffset());
    }

    @Override
    public void emit(ConstructMatch match, TranslationContext context) {
        String receiver = match.captureOrEmpty("receiver");
        String method = match.captureOrEmpty("method");
        List<ParsedParameter> parameters = placeholderParameters(match.captureOrEmpty("args"));

        FlowNode invoke = context.add(context.getUnits().memberInvoke(
                method, VisualScriptingCatalog.receiverType(receiver), parameters, "void", false));
        context.enterControl(invoke);

        log.debug("[translator] call {}.{} with {} argument(s)", receiver, method, parameters.size());
    }

    /**
     * True when the text just before {@code offset}, on the same line, contains '='.
     */
    boolean followsAssignment(String body, int offset) {
        String before = body.substring(Math.max(0, offset - properties.getCallLookbehindChars()), offset);
        String sameLine = before.substring(before.lastIndexOf('\n') + 1);
        return sameLine.contains("=");
    }

    static List<ParsedParameter> placeholderParameters(String args) {
        List<ParsedParameter> parameters = new ArrayList<>();
        long count = Arrays.stream(args.split(","))
                .map(String::trim)
                .filter(arg -> !arg.isEmpty())
                .count();
        for (int i = 0; i < count; i++) {
            parameters.add(ParsedParameter.builder()
                    .type(VisualScriptingCatalog.SYSTEM_OBJECT)
                    .name("arg" + i)
                    .build());
        }
        return parameters;
    }
}
