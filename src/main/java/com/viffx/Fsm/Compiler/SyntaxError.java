package com.viffx.Fsm.Compiler;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Raised when the source cannot be tokenized or when the parser reaches a token for
 * which the parse table has no action. Parsing stops at the first such token.
 */
public class SyntaxError extends Exception {
    private final Position position;
    private final Token token;
    private final ImmutableList<String> expected;

    /**
     * Creates an error for a token the parse table has no action for.
     *
     * @param token    the offending token
     * @param expected descriptions of the terminals that would have been accepted
     */
    public SyntaxError(@NotNull Token token, @NotNull List<String> expected) {
        super(token.position() + ": unexpected " + token
                + (expected.isEmpty() ? "" : ", expected one of " + expected));
        this.position = token.position();
        this.token = token;
        this.expected = ImmutableList.copyOf(expected);
    }

    /**
     * Creates an error for a token whose type fits the grammar but whose value is malformed.
     *
     * @param token   the offending token
     * @param message what is wrong with its value
     */
    public SyntaxError(@NotNull Token token, @NotNull String message) {
        super(token.position() + ": " + message);
        this.position = token.position();
        this.token = token;
        this.expected = ImmutableList.of();
    }

    /**
     * Creates an error raised while tokenizing, before any token exists.
     *
     * @param position where the lexer stopped
     * @param message  what went wrong
     */
    public SyntaxError(@NotNull Position position, @NotNull String message) {
        super(position + ": " + message);
        this.position = position;
        this.token = null;
        this.expected = ImmutableList.of();
    }

    public Position position() {
        return position;
    }

    /**
     * @return the offending token, or {@code null} for errors raised by the lexer
     */
    @Nullable
    public Token token() {
        return token;
    }

    public ImmutableList<String> expected() {
        return expected;
    }
}
