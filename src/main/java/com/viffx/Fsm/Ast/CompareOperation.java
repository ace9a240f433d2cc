package com.viffx.Fsm.Ast;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * {@code a.x == b.y}
 */
public record CompareOperation(FieldAccess left, CompareOperator operator, FieldAccess right) implements LogicElement {

    public CompareOperation {
        checkNotNull(left, "left");
        checkNotNull(operator, "operator");
        checkNotNull(right, "right");
    }

    @Override
    public String toString() {
        return left + " " + operator + " " + right;
    }
}
