package com.architecture.memory.flowgraph.service.translation.handler;

import com.architecture.memory.flowgraph.model.graph.FlowNode;
import com.architecture.memory.flowgraph.service.translation.ArithmeticOperator;
import com.architecture.memory.flowgraph.service.translation.ConstructCategory;
import com.architecture.memory.flowgraph.service.translation.ConstructMatch;
import com.architecture.memory.flowgraph.service.translation.TranslationContext;
import com.architecture.memory.flowgraph.service.translation.UnitFactory;
import com.architecture.memory.flowgraph.service.translation.VisualScriptingCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Simple assignments {@code name = expression;}. An arithmetic operator in the expression becomes an
 * operator unit feeding the variable input; its operands are not synthesized.
 */
@Component
@Slf4j
public class AssignmentHandler extends AbstractPatternHandler {

    // '=' not followed by another '=' so equality tests are not taken for assignments
    private static final Pattern ASSIGNMENT_PATTERN = Pattern.compile("(?<name>\\w+)\\s*=(?!=)\\s*(?<value>[^;]+);");

    @Override
    public ConstructCategory category() {
        return ConstructCategory.ASSIGNMENT;
    }

    @Override
    protected Pattern pattern() {
        return ASSIGNMENT_PATTERN;
    }

    @Override
    protected String[] captureNames() {
        return new String[]{"name", "value"};
    }

    @Override
    public void emit(ConstructMatch match, TranslationContext context) {
        UnitFactory units = context.getUnits();
        String name = match.captureOrEmpty("name");
        String value = match.captureOrEmpty("value").trim();

        FlowNode setVariable = context.add(units.setVariable(name, VisualScriptingCatalog.SYSTEM_OBJECT));
        context.enterControl(setVariable);

        Optional<ArithmeticOperator> operator = ArithmeticOperator.firstIn(value);
        operator.ifPresent(op -> {
            FlowNode arithmetic = context.add(units.arithmetic(op));
            context.connectValue(arithmetic, UnitFactory.RESULT, setVariable, "input");
        });

        log.debug("[translator] {} = {} arithmetic={}", name, value,
                operator.map(ArithmeticOperator::getSymbol).orElse("none"));
    }
}
