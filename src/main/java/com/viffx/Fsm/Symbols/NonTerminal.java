package com.viffx.Fsm.Symbols;

public record NonTerminal(String value) implements Symbol {
    public static final NonTerminal START = new NonTerminal("START");

    @Override
    public String toString() {
        return value;
    }
}
