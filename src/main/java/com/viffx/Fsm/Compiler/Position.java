package com.viffx.Fsm.Compiler;

/**
 * A 1-based line and column in the source text.
 */
public record Position(int line, int column) {
    public static final Position START = new Position(1, 1);

    public Position {
        if (line < 1 || column < 1) throw new IllegalArgumentException("Positions are 1-based: " + line + ":" + column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
