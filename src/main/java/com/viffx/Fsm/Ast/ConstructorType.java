package com.viffx.Fsm.Ast;

public enum ConstructorType {
    ENUMERATION,
    STRICT,
    DESCRIBE
}
