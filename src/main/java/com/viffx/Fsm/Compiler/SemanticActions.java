package com.viffx.Fsm.Compiler;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.viffx.Fsm.Grammar.Grammar;

import java.util.ArrayList;
import java.util.Set;
import java.util.TreeSet;

/**
 * Binds every production of a grammar to the reduction named by its {@code @action}.
 */
public final class SemanticActions {

    /**
     * Builds the value of a production's left hand side from the values of its right hand side.
     */
    @FunctionalInterface
    public interface Reduction {
        Object reduce(Children children);
    }

    /**
     * The values of the right hand side of a production being reduced, in source order.
     * Terminals are {@link Token}s, non-terminals whatever their own reduction returned.
     */
    public static final class Children {
        private final Object[] values;

        Children(Object[] values) {
            this.values = values;
        }

        public int size() {
            return values.length;
        }

        public Object get(int index) {
            return values[index];
        }

        public <T> T get(int index, Class<T> type) {
            Object value = values[index];
            if (!type.isInstance(value)) {
                throw new IllegalStateException("child " + index + " is " + value + ", expected a " + type.getSimpleName());
            }
            return type.cast(value);
        }

        public Token token(int index) {
            return get(index, Token.class);
        }

        public String text(int index) {
            return token(index).value();
        }

        public Elements elements(int index) {
            return get(index, Elements.class);
        }

        /**
         * Freezes the accumulator at {@code index}, checking every element against {@code type}.
         */
        public <T> ImmutableList<T> list(int index, Class<T> type) {
            ImmutableList.Builder<T> list = ImmutableList.builder();
            for (Object element : elements(index)) {
                list.add(type.cast(element));
            }
            return list.build();
        }
    }

    /**
     * Accumulator of a left-recursive list rule, appended to as the rule is reduced.
     */
    public static final class Elements extends ArrayList<Object> {
    }

    private final Reduction[] reductions;

    private SemanticActions(Reduction[] reductions) {
        this.reductions = reductions;
    }

    /**
     * Resolves the actions of every production of {@code grammar} against the AST reductions.
     *
     * @throws IllegalStateException if the grammar names an action that does not exist
     */
    public static SemanticActions forGrammar(Grammar grammar) {
        return forGrammar(grammar, AstBuilder.reductions());
    }

    static SemanticActions forGrammar(Grammar grammar, ImmutableMap<String, Reduction> available) {
        Reduction[] reductions = new Reduction[grammar.productionsCount()];
        Set<String> missing = new TreeSet<>();
        for (int i = 0; i < reductions.length; i++) {
            String action = grammar.production(i).action();
            reductions[i] = available.get(action);
            if (reductions[i] == null) missing.add(action);
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException(grammar.name() + " names unknown semantic actions: " + missing);
        }
        return new SemanticActions(reductions);
    }

    /**
     * Runs the reduction of production {@code production}.
     *
     * @param values one value per right hand side symbol
     */
    public Object reduce(int production, Object[] values) {
        return reductions[production].reduce(new Children(values));
    }

    static Elements newList(Object first) {
        Elements list = new Elements();
        list.add(first);
        return list;
    }

    static Elements append(Elements list, Object value) {
        list.add(value);
        return list;
    }
}
