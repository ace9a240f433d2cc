package com.viffx.Fsm.Utils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.function.IntPredicate;

/**
 * A two character window over a {@link Reader}: the current character and one character of
 * lookahead. Both the source lexer and the grammar reader scan through it.
 * <p>
 * Subclasses that need to know where they are override {@link #onNextChar()}.
 */
public class LexicalCharacterBuffer {
    private static final int END = -1;

    private final BufferedReader reader;

    // [0] current character, [1] lookahead, END past the input
    private final int[] window = new int[2];

    public LexicalCharacterBuffer(Reader source) throws IOException {
        reader = source instanceof BufferedReader b ? b : new BufferedReader(source);
        window[0] = reader.read();
        window[1] = window[0] == END ? END : reader.read();
    }

    public final boolean eof() {
        return window[0] == END;
    }

    /**
     * @return {@code true} if there is no character after the current one
     */
    public final boolean peekEof() {
        return window[1] == END;
    }

    public final char crntChar() {
        return (char) window[0];
    }

    public final char peekChar() {
        return (char) window[1];
    }

    /**
     * Consumes the current character.
     *
     * @return the character that is current afterwards
     * @throws IOException if the input is exhausted or cannot be read
     */
    public final char nextChar() throws IOException {
        if (eof()) throw new IOException("Reached the end of the input.");

        onNextChar();
        window[0] = window[1];
        window[1] = window[0] == END ? END : reader.read();
        return crntChar();
    }

    /**
     * Consumes characters as long as they match.
     *
     * @param matches tested against the current character
     * @return the consumed characters
     */
    public final String takeWhile(IntPredicate matches) throws IOException {
        StringBuilder taken = new StringBuilder();
        while (!eof() && matches.test(crntChar())) {
            taken.append(crntChar());
            nextChar();
        }
        return taken.toString();
    }

    /**
     * Called before every shift, while {@link #crntChar()} is still the character being consumed.
     */
    public void onNextChar() {}

    /**
     * Shows the window for error messages, for example {@code ['a','\n']}.
     */
    public String buffer() {
        return "['" + describe(window[0]) + "','" + describe(window[1]) + "']";
    }

    private static String describe(int c) {
        return switch (c) {
            case END -> "EOF";
            case '\t' -> "\\t";
            case '\n' -> "\\n";
            case '\r' -> "\\r";
            default -> String.valueOf((char) c);
        };
    }
}
