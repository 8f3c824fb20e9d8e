package com.architecture.memory.flowgraph.service.translation;

import java.util.Arrays;
import java.util.Optional;

/**
 * Arithmetic operators in recognition order.
 */
public enum ArithmeticOperator {
    ADD("+", "GenericAdd"),
    SUBTRACT("-", "GenericSubtract"),
    MULTIPLY("*", "GenericMultiply"),
    DIVIDE("/", "GenericDivide"),
    MODULO("%", "GenericModulo");

    private final String symbol;
    private final String unitType;

    ArithmeticOperator(String symbol, String unitName) {
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
     * First operator found in an assigned expression. Quoted strings never yield an operator.
     */
    public static Optional<ArithmeticOperator> firstIn(String expression) {
        if (expression == null || expression.startsWith("\"")) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(op -> expression.contains(op.symbol))
                .findFirst();
    }
}
