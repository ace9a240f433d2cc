package com.viffx.Fsm.Ast;

/**
 * One element of a {@link LogicOperations} chain.
 */
public sealed interface LogicElement permits CompareOperation, LogicOperator {
}
