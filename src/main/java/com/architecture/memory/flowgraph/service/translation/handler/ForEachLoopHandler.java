package com.architecture.memory.flowgraph.service.translation.handler;

import com.architecture.memory.flowgraph.model.graph.FlowNode;
import com.architecture.memory.flowgraph.service.translation.ConstructCategory;
import com.architecture.memory.flowgraph.service.translation.ConstructMatch;
import com.architecture.memory.flowgraph.service.translation.TranslationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * {@code foreach (var item in items)} loops. The collection input is left unconnected.
 */
@Component
@Slf4j
public class ForEachLoopHandler extends AbstractPatternHandler {

    private static final Pattern FOREACH_PATTERN = Pattern.compile(
            "\\bforeach\\s*\\(\\s*(?:var|(?<type>\\w+))\\s+(?<item>\\w+)\\s+in\\s+(?<collection>[^)]+)\\)");

    @Override
    public ConstructCategory category() {
        return ConstructCategory.FOREACH_LOOP;
    }

    @Override
    protected Pattern pattern() {
        return FOREACH_PATTERN;
    }

    @Override
    protected String[] captureNames() {
        return new String[]{"type", "item", "collection"};
    }

    @Override
    public void emit(ConstructMatch match, TranslationContext context) {
        FlowNode loop = context.add(context.getUnits().forEachLoop());
        context.enterControl(loop);
        log.debug("[translator] foreach {} {} in {}", match.capture("type").orElse("var"),
                match.captureOrEmpty("item"), match.captureOrEmpty("collection").trim());
    }
}
