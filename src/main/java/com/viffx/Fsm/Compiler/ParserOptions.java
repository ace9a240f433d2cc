package com.viffx.Fsm.Compiler;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Settings of a {@link Parser}. Instances are immutable; {@code with...} returns a copy.
 */
public final class ParserOptions {
    private final ParseTable table;
    private final boolean traceActions;

    private ParserOptions(ParseTable table, boolean traceActions) {
        this.table = table;
        this.traceActions = traceActions;
    }

    /**
     * The bundled grammar's table, no tracing.
     */
    public static ParserOptions defaults() {
        return new ParserOptions(null, false);
    }

    public ParserOptions withTable(@NotNull ParseTable table) {
        return new ParserOptions(Objects.requireNonNull(table, "table cannot be null"), traceActions);
    }

    /**
     * @param traceActions log every shift and reduce at DEBUG
     */
    public ParserOptions withTraceActions(boolean traceActions) {
        return new ParserOptions(table, traceActions);
    }

    public ParseTable table() {
        // the standard table is only built when someone asks for it
        return table == null ? ParseTable.standard() : table;
    }

    public boolean traceActions() {
        return traceActions;
    }

    @Override
    public String toString() {
        return "ParserOptions{table=" + (table == null ? "standard" : table.grammar().name())
                + ", traceActions=" + traceActions + '}';
    }
}
