package com.viffx.Fsm.Grammar;

import java.io.IOException;

/**
 * Thrown when a grammar definition is malformed.
 */
public class GrammarException extends IOException {
    public GrammarException(String message) {
        super(message);
    }
}
