package com.architecture.memory.flowgraph.service.translation.handler;

import com.architecture.memory.flowgraph.model.graph.FlowNode;
import com.architecture.memory.flowgraph.service.translation.ConstructCategory;
import com.architecture.memory.flowgraph.service.translation.ConstructMatch;
import com.architecture.memory.flowgraph.service.translation.TranslationContext;
import com.architecture.memory.flowgraph.service.translation.UnitFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Counting loops: {@code for (int i = start; i < end; i++)}.
 *
 * Emits a For unit fed by two integer literals. A bound that is not a plain integer literal
 * falls back to 0 (first index) or 10 (last index).
 */
@Component
@Slf4j
public class ForLoopHandler extends AbstractPatternHandler {

    static final int DEFAULT_FIRST_INDEX = 0;
    static final int DEFAULT_LAST_INDEX = 10;

    private static final Pattern FOR_PATTERN = Pattern.compile(
            "\\bfor\\s*\\(\\s*(?:int|var)\\s+(?<var>\\w+)\\s*=\\s*(?<start>[^;]+);"
                    + "\\s*\\k<var>\\s*(?<cmp>[<>]=?)\\s*(?<end>[^;]+);"
                    + "\\s*\\k<var>\\s*(?<step>\\+\\+|--|\\+=\\s*\\d+|-=\\s*\\d+)\\s*\\)");

    private static final Pattern PLAIN_INTEGER = Pattern.compile("\\d+");

    @Override
    public ConstructCategory category() {
        return ConstructCategory.FOR_LOOP;
    }

    @Override
    protected Pattern pattern() {
        return FOR_PATTERN;
    }

    @Override
    protected String[] captureNames() {
        return new String[]{"var", "start", "cmp", "end", "step"};
    }

    @Override
    public void emit(ConstructMatch match, TranslationContext context) {
        UnitFactory units = context.getUnits();
        int first = parseBound(match.captureOrEmpty("start"), DEFAULT_FIRST_INDEX);
        int last = parseBound(match.captureOrEmpty("end"), DEFAULT_LAST_INDEX);

        FlowNode loop = context.add(units.forLoop());
        FlowNode firstLiteral = context.add(units.literal(first, "int"));
        FlowNode lastLiteral = context.add(units.literal(last, "int"));

        context.enterControl(loop);
        context.connectValue(firstLiteral, UnitFactory.OUTPUT, loop, "firstIndex");
        context.connectValue(lastLiteral, UnitFactory.OUTPUT, loop, "lastIndex");

        log.debug("[translator] for {} in [{}, {}] step {}", match.captureOrEmpty("var"), first, last,
                match.captureOrEmpty("step"));
    }

    static int parseBound(String text, int fallback) {
        String trimmed = text.trim();
        if (!PLAIN_INTEGER.matcher(trimmed).matches()) {
            return fallback;
        }
        try {
            return Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
