package com.viffx.Fsm.Ast;

import java.util.Locale;

/**
 * Reserved words that may stand for the symbol or the destination of a transition.
 */
public enum TransitionKeyword {
    ELSE,
    DEADEND,
    ALPHABET,
    ITSELF;

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TransitionKeyword fromKeyword(String keyword) {
        for (TransitionKeyword value : values()) {
            if (value.keyword().equals(keyword)) return value;
        }
        throw new IllegalArgumentException("Not a transition keyword: " + keyword);
    }

    @Override
    public String toString() {
        return keyword();
    }
}
