package com.viffx.Fsm.Grammar;

import com.viffx.Fsm.Symbols.NonTerminal;
import com.viffx.Fsm.Symbols.Symbol;
import com.viffx.Fsm.Symbols.SymbolType;
import com.viffx.Fsm.Symbols.Terminal;

/**
 * A token of a grammar definition file.
 * <p>
 * Terminals keep their {@link SymbolType} in {@code terminalType}; every other kind of token
 * only has a {@code value}.
 */
public record GrammarToken(Type type, SymbolType terminalType, String value) {
    public static final GrammarToken EOF = new GrammarToken(Type.EOF, null, null);
    public static final GrammarToken START = nonTerminal(NonTerminal.START.value());

    public enum Type {
        NON_TERMINAL,
        TERMINAL,
        SYMBOL, // one of > | ;
        ACTION, // @name
        EOF
    }

    public static GrammarToken nonTerminal(String name) {
        return new GrammarToken(Type.NON_TERMINAL, null, name);
    }

    public static GrammarToken terminal(SymbolType type, String value) {
        return new GrammarToken(Type.TERMINAL, type, value);
    }

    public static GrammarToken symbol(char c) {
        return new GrammarToken(Type.SYMBOL, null, String.valueOf(c));
    }

    public static GrammarToken action(String name) {
        return new GrammarToken(Type.ACTION, null, name);
    }

    public boolean isSymbol(String value) {
        return type == Type.SYMBOL && value.equals(this.value);
    }

    /**
     * Converts a terminal or non-terminal token into the grammar symbol it declares.
     *
     * @return the symbol
     * @throws IllegalStateException if this token does not declare a symbol
     */
    public Symbol decompose() {
        return switch (type) {
            case NON_TERMINAL -> new NonTerminal(value);
            case TERMINAL -> new Terminal(terminalType, value);
            default -> throw new IllegalStateException(this + " is not a grammar symbol");
        };
    }

    @Override
    public String toString() {
        return switch (type) {
            case TERMINAL -> terminalType + "(" + (value == null ? "" : value) + ")";
            case EOF -> "EOF";
            default -> type + "(" + value + ")";
        };
    }
}
