package com.viffx.Fsm.Ast;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * {@code def name : DeclaredType = <constructor>}.
 */
public record Alphabet(String name, String declaredType, AlphabetConstructor constructor) implements Declaration {

    public Alphabet {
        checkNotNull(name, "name");
        checkNotNull(declaredType, "declaredType");
        checkNotNull(constructor, "constructor");
    }

    public ConstructorType constructorType() {
        return constructor.type();
    }

    /**
     * Returns the {@link Term}s of an enumeration or strict alphabet, or the
     * {@link AlphabetConstructor.DescribeEntry}s of a describe alphabet.
     */
    public List<?> constructorParams() {
        return constructor.params();
    }
}
