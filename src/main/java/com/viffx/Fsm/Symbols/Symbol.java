package com.viffx.Fsm.Symbols;

public sealed interface Symbol permits Terminal, NonTerminal {
    String value();
}
