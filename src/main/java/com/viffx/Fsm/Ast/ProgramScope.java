package com.viffx.Fsm.Ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The root of the syntax tree: every top level declaration in source order.
 */
public record ProgramScope(List<Declaration> declarations) {

    public ProgramScope {
        declarations = ImmutableList.copyOf(declarations);
        checkArgument(!declarations.isEmpty(), "a program declares at least one alphabet, automaton or class");
    }

    public ImmutableList<Alphabet> alphabets() {
        return filter(Alphabet.class);
    }

    public ImmutableList<Automaton> automata() {
        return filter(Automaton.class);
    }

    public ImmutableList<ClassDefinition> classes() {
        return filter(ClassDefinition.class);
    }

    private <T extends Declaration> ImmutableList<T> filter(Class<T> type) {
        ImmutableList.Builder<T> builder = ImmutableList.builder();
        for (Declaration declaration : declarations) {
            if (type.isInstance(declaration)) builder.add(type.cast(declaration));
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return AstPrinter.print(this);
    }
}
