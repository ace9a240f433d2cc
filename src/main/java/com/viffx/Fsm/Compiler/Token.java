package com.viffx.Fsm.Compiler;

import com.viffx.Fsm.Symbols.SymbolType;
import com.viffx.Fsm.Symbols.Terminal;

import java.util.Objects;

/**
 * A lexical token: the terminal it was classified as, its text and where it starts.
 */
public record Token(SymbolType type, String value, Position position) {

    public Token {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(position, "position cannot be null");
    }

    public static Token eof(Position position) {
        return new Token(SymbolType.EOF, null, position);
    }

    public Terminal terminal() {
        return new Terminal(type, value);
    }

    public boolean isEof() {
        return type == SymbolType.EOF;
    }

    @Override
    public String toString() {
        if (isEof()) return "end of input";
        return type + "(" + value + ")";
    }
}
