package com.viffx.Fsm.Ast;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * {@code def name : DeclaredType = Generator.(alphabetName).{ body }}.
 * The alphabet is referenced by name only.
 */
public record Automaton(String name, String declaredType, String generator, String alphabetName, AutomatonBody body) implements Declaration {

    public Automaton {
        checkNotNull(name, "name");
        checkNotNull(declaredType, "declaredType");
        checkNotNull(generator, "generator");
        checkNotNull(alphabetName, "alphabetName");
        checkNotNull(body, "body");
    }
}
