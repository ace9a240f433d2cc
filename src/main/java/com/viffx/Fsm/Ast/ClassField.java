package com.viffx.Fsm.Ast;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * {@code name : Type} or {@code name : Type = default}. Also used for method parameters.
 */
public record ClassField(String name, String fieldType, @Nullable Term defaultValue) {

    public ClassField {
        checkNotNull(name, "name");
        checkNotNull(fieldType, "fieldType");
        checkArgument(defaultValue == null || defaultValue.isConcrete(),
                "the default of %s must be a literal or a constructed value", name);
    }

    public Optional<Term> defaultTerm() {
        return Optional.ofNullable(defaultValue);
    }
}
