package com.viffx.Fsm.Ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * {@code override fun name(fields) : ReturnType { return (operations) }}
 */
public record ClassMethod(String name, List<ClassField> fields, String returnType, LogicOperations operations) {

    public ClassMethod {
        checkNotNull(name, "name");
        fields = ImmutableList.copyOf(fields);
        checkNotNull(returnType, "returnType");
        checkNotNull(operations, "operations");
    }
}
