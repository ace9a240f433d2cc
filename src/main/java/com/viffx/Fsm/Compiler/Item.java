package com.viffx.Fsm.Compiler;

/**
 * An LR item: production {@code index} with the dot before its {@code dot}-th symbol.
 * A {@code null} lookahead makes the item an LR(0) core.
 */
public record Item(int index, int dot, Integer lookahead) {
    public Item core() {
        return new Item(index, dot, null);
    }

    public Item advance() {
        return new Item(index, dot + 1, lookahead);
    }

    public Item withLookahead(int lookahead) {
        return new Item(index, dot, lookahead);
    }
}
