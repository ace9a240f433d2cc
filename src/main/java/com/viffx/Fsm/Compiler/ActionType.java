package com.viffx.Fsm.Compiler;

public enum ActionType {
    SHIFT,
    REDUCE,
    GOTO,
    ACCEPT
}
