package com.viffx.Fsm.Symbols;

import java.util.Objects;

/**
 * A grammar terminal. A {@code null} value stands for every token of the given type.
 */
public record Terminal(SymbolType type, String value) implements Symbol {
    public static final Terminal EOF = new Terminal(SymbolType.EOF, "$");

    public Terminal {
        Objects.requireNonNull(type, "type cannot be null");
    }

    /**
     * Returns the wildcard terminal matching every token of this terminal's type.
     *
     * @return a terminal of the same type with a {@code null} value
     */
    public Terminal wildcard() {
        return value == null ? this : new Terminal(type, null);
    }

    @Override
    public String toString() {
        return type + "(" + (value == null ? "" : value.replaceAll("\n", "\\\\n")) + ")";
    }
}
