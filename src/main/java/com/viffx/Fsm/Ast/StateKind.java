package com.viffx.Fsm.Ast;

public enum StateKind {
    START,
    REGULAR,
    TERMINAL
}
