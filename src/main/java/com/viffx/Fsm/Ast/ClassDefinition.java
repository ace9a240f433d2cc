package com.viffx.Fsm.Ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * {@code class Name(fields) : Parent { methods }}. The parent class is referenced by name only.
 */
public record ClassDefinition(String className, String inheritedFrom, List<ClassField> params, List<ClassMethod> methods) implements Declaration {

    public ClassDefinition {
        checkNotNull(className, "className");
        checkNotNull(inheritedFrom, "inheritedFrom");
        params = ImmutableList.copyOf(params);
        methods = ImmutableList.copyOf(methods);
        checkArgument(!params.isEmpty(), "class %s declares no fields", className);
        checkArgument(!methods.isEmpty(), "class %s declares no methods", className);
    }

    @Override
    public String name() {
        return className;
    }
}
