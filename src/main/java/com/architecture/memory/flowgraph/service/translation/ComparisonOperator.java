package com.architecture.memory.flowgraph.service.translation;

import java.util.Arrays;
import java.util.Optional;

/**
 * Comparison operators in recognition order: two-character operators are tried before '<' and '>'.
 */
public enum ComparisonOperator {
    LESS_OR_EQUAL("<=", "GenericLessOrEqual"),
    GREATER_OR_EQUAL(">=", "GenericGreaterOrEqual"),
    EQUAL("==", "GenericEqual"),
    NOT_EQUAL("!=", "GenericNotEqual"),
    LESS("<", "GenericLess"),
    GREATER(">", "GenericGreater");

    private final String symbol;
    private final String unitType;

    ComparisonOperator(String symbol, String unitName) {
        this.symbol = symbol;
        this.unitType = VisualScriptingCatalog.UNIT_NAMESPACE + unitName;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getUnitType() {
        return unitType;
    }

    /**
     * First operator, in recognition order, that occurs anywhere in the condition text.
     */
    public static Optional<ComparisonOperator> firstIn(String condition) {
        if (condition == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(op -> condition.contains(op.symbol))
                .findFirst();
    }
}
