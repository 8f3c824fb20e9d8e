package com.architecture.memory.flowgraph.service.translation.handler;

import com.architecture.memory.flowgraph.model.graph.FlowNode;
import com.architecture.memory.flowgraph.service.translation.ConstructCategory;
import com.architecture.memory.flowgraph.service.translation.ConstructMatch;
import com.architecture.memory.flowgraph.service.translation.TranslationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * {@code while (condition)} loops. The condition input is left unconnected.
 */
@Component
@Slf4j
public class WhileLoopHandler extends AbstractPatternHandler {

    private static final Pattern WHILE_PATTERN = Pattern.compile("\\bwhile\\s*\\((?<condition>[^)]+)\\)");

    @Override
    public ConstructCategory category() {
        return ConstructCategory.WHILE_LOOP;
    }

    @Override
    protected Pattern pattern() {
        return WHILE_PATTERN;
    }

    @Override
    protected String[] captureNames() {
        return new String[]{"condition"};
    }

    @Override
    public void emit(ConstructMatch match, TranslationContext context) {
        FlowNode loop = context.add(context.getUnits().whileLoop());
        context.enterControl(loop);
        log.debug("[translator] while ({})", match.captureOrEmpty("condition").trim());
    }
}
