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
 * Coroutine suspension: {@code yield return [new] Instruction[(args)]}.
 * {@code WaitForSeconds} with a single numeric literal adds a timed wait unit as the instruction.
 */
@Component
@Slf4j
public class YieldReturnHandler extends AbstractPatternHandler {

    static final String TIMED_WAIT = "WaitForSeconds";

    private static final Pattern YIELD_PATTERN = Pattern.compile(
            "\\byield\\s+return\\s+(?:new\\s+)?(?<type>\\w+)\\s*(?:\\((?<args>[^)]*)\\))?");

    // C# real literal: optional sign, digits with optional fraction and exponent, optional f/d suffix
    private static final Pattern NUMERIC_LITERAL = Pattern.compile(
            "[-+]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][-+]?\\d+)?[fFdD]?");

    @Override
    public ConstructCategory category() {
        return ConstructCategory.YIELD_RETURN;
    }

    @Override
    protected Pattern pattern() {
        return YIELD_PATTERN;
    }

    @Override
    protected String[] captureNames() {
        return new String[]{"type", "args"};
    }

    @Override
    public void emit(ConstructMatch match, TranslationContext context) {
        UnitFactory units = context.getUnits();
        String type = match.captureOrEmpty("type");

        FlowNode suspend = context.add(units.yieldReturn());
        context.enterControl(suspend);

        Optional<Float> seconds = TIMED_WAIT.equals(type)
                ? match.capture("args").flatMap(YieldReturnHandler::parseSeconds)
                : Optional.empty();
        seconds.ifPresent(value -> {
            FlowNode wait = context.add(units.waitForSeconds(value));
            context.connectValue(wait, UnitFactory.RESULT, suspend, "instruction");
        });

        log.debug("[translator] yield return {} timedWait={}", type, seconds.orElse(null));
    }

    static Optional<Float> parseSeconds(String args) {
        String trimmed = args.trim();
        if (!NUMERIC_LITERAL.matcher(trimmed).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Float.parseFloat(trimmed));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
