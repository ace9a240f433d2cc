package com.viffx.Fsm.Compiler;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.viffx.Fsm.Grammar.Grammar;
import com.viffx.Fsm.Symbols.Symbol;
import com.viffx.Fsm.Symbols.SymbolType;
import com.viffx.Fsm.Symbols.Terminal;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.*;

/**
 * The ACTION/GOTO table of a grammar. Tables are immutable once built and are shared by every
 * {@link Parser} that uses them.
 */
public final class ParseTable {
    public static final String GRAMMAR_RESOURCE = "automata.grammar";

    private final Grammar grammar;
    private final ImmutableList<ImmutableMap<Integer, Action>> rows;

    private ParseTable(Grammar grammar, List<Map<Integer, Action>> rows) {
        this.grammar = grammar;
        ImmutableList.Builder<ImmutableMap<Integer, Action>> builder = ImmutableList.builder();
        for (Map<Integer, Action> row : rows) builder.add(ImmutableMap.copyOf(row));
        this.rows = builder.build();
    }

    /**
     * Generates the table of a grammar and checks that the semantic actions cover it.
     *
     * @throws IllegalStateException if the grammar is not LALR(1) or names an unknown action
     */
    public static ParseTable build(@NotNull Grammar grammar) {
        SemanticActions.forGrammar(grammar);
        return new ParseTable(grammar, new LALR1ParseTableGenerator(grammar).generate());
    }

    /**
     * Returns the table of the bundled automaton grammar, building it on first use.
     */
    public static ParseTable standard() {
        return StandardHolder.TABLE;
    }

    private static final class StandardHolder {
        private static final ParseTable TABLE = load();

        private static ParseTable load() {
            try {
                return build(Grammar.load(GRAMMAR_RESOURCE));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot load " + GRAMMAR_RESOURCE, e);
            }
        }
    }

    public Grammar grammar() {
        return grammar;
    }

    public int stateCount() {
        return rows.size();
    }

    @Nullable
    public Action action(int state, int symbol) {
        return rows.get(state).get(symbol);
    }

    /**
     * Maps a token to the grammar terminal it stands for in {@code state}: the terminal with
     * the token's exact value when the state has an action for it, otherwise the terminal
     * matching any value of the token's type.
     *
     * @return the symbol index, or {@code -1} if the grammar knows neither terminal
     */
    public int symbolIndex(int state, Token token) {
        if (token.isEof()) return grammar.EOF();
        Terminal terminal = token.terminal();
        int exact = grammar.indexOf(terminal);
        if (exact >= 0 && rows.get(state).containsKey(exact)) return exact;
        int wildcard = grammar.indexOf(terminal.wildcard());
        return wildcard >= 0 ? wildcard : exact;
    }

    /**
     * Describes the terminals that have an action in {@code state}, sorted.
     */
    public List<String> expected(int state) {
        List<String> expected = new ArrayList<>();
        for (int symbol : rows.get(state).keySet()) {
            if (grammar.isNonTerminal(symbol)) continue;
            expected.add(describe(grammar.symbol(symbol)));
        }
        Collections.sort(expected);
        return expected;
    }

    private static String describe(Symbol symbol) {
        Terminal terminal = (Terminal) symbol;
        if (terminal.type() == SymbolType.EOF) return "end of input";
        if (terminal.value() == null) return terminal.type().name();
        return "'" + terminal.value() + "'";
    }
}
