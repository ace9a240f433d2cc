package com.viffx.Fsm.Ast;

public enum CompareOperator {
    EQUAL("=="),
    NOT_EQUAL("!="),
    LESS("<"),
    LESS_OR_EQUAL("<="),
    GREATER(">"),
    GREATER_OR_EQUAL(">=");

    private final String symbol;

    CompareOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static CompareOperator fromSymbol(String symbol) {
        for (CompareOperator operator : values()) {
            if (operator.symbol.equals(symbol)) return operator;
        }
        throw new IllegalArgumentException("Not a comparison operator: " + symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
