package com.viffx.Fsm.Ast;

/**
 * A top level statement of a program.
 */
public sealed interface Declaration permits Alphabet, Automaton, ClassDefinition {
    String name();
}
