package com.viffx.Fsm.Ast;

public enum LogicOperator implements LogicElement {
    AND("&&"),
    OR("||");

    private final String symbol;

    LogicOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static LogicOperator fromSymbol(String symbol) {
        for (LogicOperator operator : values()) {
            if (operator.symbol.equals(symbol)) return operator;
        }
        throw new IllegalArgumentException("Not a logic operator: " + symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
