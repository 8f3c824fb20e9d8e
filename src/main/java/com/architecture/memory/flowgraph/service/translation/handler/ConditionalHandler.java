package com.architecture.memory.flowgraph.service.translation.handler;

import com.architecture.memory.flowgraph.model.graph.FlowNode;
import com.architecture.memory.flowgraph.service.translation.ComparisonOperator;
import com.architecture.memory.flowgraph.service.translation.ConstructCategory;
import com.architecture.memory.flowgraph.service.translation.ConstructMatch;
import com.architecture.memory.flowgraph.service.translation.TranslationContext;
import com.architecture.memory.flowgraph.service.translation.UnitFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * {@code if (condition)} branches. A comparison in the condition becomes a comparison unit feeding the
 * branch condition; its operands are not synthesized.
 */
@Component
@Slf4j
public class ConditionalHandler extends AbstractPatternHandler {

    private static final Pattern IF_PATTERN = Pattern.compile("\\bif\\s*\\((?<condition>[^)]+)\\)");

    @Override
    public ConstructCategory category() {
        return ConstructCategory.CONDITIONAL;
    }

    @Override
    protected Pattern pattern() {
        return IF_PATTERN;
    }

    @Override
    protected String[] captureNames() {
        return new String[]{"condition"};
    }

    @Override
    public void emit(ConstructMatch match, TranslationContext context) {
        UnitFactory units = context.getUnits();
        String condition = match.captureOrEmpty("condition").trim();

        FlowNode branch = context.add(units.branch());
        context.enterControl(branch);

        Optional<ComparisonOperator> operator = ComparisonOperator.firstIn(condition);
        operator.ifPresent(op -> {
            FlowNode comparison = context.add(units.comparison(op));
            context.connectValue(comparison, UnitFactory.RESULT, branch, "condition");
        });

        log.debug("[translator] if ({}) comparison={}", condition,
                operator.map(ComparisonOperator::getSymbol).orElse("none"));
    }
}
