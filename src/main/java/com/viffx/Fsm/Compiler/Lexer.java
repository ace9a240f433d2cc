package com.viffx.Fsm.Compiler;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.viffx.Fsm.Symbols.SymbolType;
import com.viffx.Fsm.Utils.LexicalCharacterBuffer;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.viffx.Fsm.Symbols.SymbolType.*;
import static java.lang.Character.isDigit;
import static java.lang.Character.isLetter;
import static java.lang.Character.isLetterOrDigit;
import static java.lang.Character.isUpperCase;

/**
 * Splits automaton description source into {@link Token}s.
 * <p>
 * Identifiers starting with an upper-case letter are type identifiers ({@code TYPE}),
 * all other identifiers are value identifiers ({@code ID}) unless they are keywords.
 * Text between two {@code #} characters is returned as a {@code COMMENT} token.
 */
public class Lexer {
    public static final Set<String> KEYWORDS = ImmutableSet.of(
            "def", "class", "override", "fun", "return", "start", "terminal",
            "else", "deadend", "alphabet", "itself", "from");

    // two character operators must be tried before their one character prefixes
    private static final ImmutableMap<String, SymbolType> OPERATORS = ImmutableMap.<String, SymbolType>builder()
            .put("->", SYM)
            .put("==", CMP)
            .put("!=", CMP)
            .put("<=", CMP)
            .put(">=", CMP)
            .put("&&", LOGIC)
            .put("||", LOGIC)
            .put(":", SYM)
            .put("=", SYM)
            .put("{", SYM)
            .put("}", SYM)
            .put("(", SYM)
            .put(")", SYM)
            .put(",", SYM)
            .put(".", SYM)
            .put("<", CMP)
            .put(">", CMP)
            .build();

    private final LexicalCharacterBuffer buffer;
    private int line = 1;
    private int column = 1;
    private Token nextToken = null;

    public Lexer(Reader source) throws IOException {
        buffer = new LexicalCharacterBuffer(source) {
            @Override
            public void onNextChar() {
                if (crntChar() == '\n') {
                    line++;
                    column = 1;
                } else {
                    column++;
                }
            }
        };
    }

    /**
     * @return {@code true} if {@code text} is an operator this lexer classifies as {@code type}
     */
    static boolean isOperator(SymbolType type, String text) {
        return OPERATORS.get(text) == type;
    }

    /**
     * Tokenizes a complete source text.
     *
     * @param source the source text
     * @return every token of the source, the last one being the end of input
     * @throws SyntaxError if the source contains a character sequence that is not a token
     */
    public static List<Token> tokenize(String source) throws SyntaxError {
        try {
            return new Lexer(new StringReader(source)).tokenize();
        } catch (IOException e) {
            throw new UncheckedIOException("Reading from a string failed", e);
        }
    }

    /**
     * Reads the remaining tokens, up to and including the end of input token.
     */
    public List<Token> tokenize() throws IOException, SyntaxError {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = next();
            tokens.add(token);
        } while (!token.isEof());
        return tokens;
    }

    // Gets the next token.
    public Token next() throws IOException, SyntaxError {
        // Peeking optimization
        if (nextToken != null) {
            Token temp = nextToken;
            nextToken = null;
            return temp;
        }

        // Skip any white space
        buffer.takeWhile(Character::isWhitespace);

        // Never process past the end of the source
        if (buffer.eof()) return Token.eof(position());

        Position start = position();
        char c = buffer.crntChar();
        return switch (c) {
            case '"' -> new Token(STR, nextBlock('"', start), start);
            case '#' -> new Token(COMMENT, nextBlock('#', start), start);
            case '\'' -> nextCharLiteral(start);
            default -> {
                if (isDigit(c)) yield nextNumber(start);
                if (isLetter(c) || c == '_') yield nextWord(start);
                yield nextSymbol(start);
            }
        };
    }

    /* Returns the next token without consuming it.
     * The peeked token is handed out by the following call to next. */
    public Token peek() throws IOException, SyntaxError {
        if (nextToken == null) nextToken = next();
        return nextToken;
    }

    public Position position() {
        return new Position(line, column);
    }

    // Methods used by next to handle different cases
    private Token nextCharLiteral(Position start) throws IOException, SyntaxError {
        String value = nextBlock('\'', start);
        if (value.length() != 1) {
            throw new SyntaxError(start, "a character literal must hold exactly one character, got '" + value + "'");
        }
        return new Token(CHR, value, start);
    }

    private Token nextNumber(Position start) throws IOException, SyntaxError {
        String digits = buffer.takeWhile(Character::isDigit);
        try {
            Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw new SyntaxError(start, "integer literal out of range: " + digits);
        }
        return new Token(NUM, digits, start);
    }

    private Token nextWord(Position start) throws IOException {
        String word = buffer.takeWhile(c -> isLetterOrDigit(c) || c == '_');
        if (KEYWORDS.contains(word)) return new Token(KEY, word, start);
        if (isUpperCase(word.charAt(0))) return new Token(TYPE, word, start);
        return new Token(ID, word, start);
    }

    private Token nextSymbol(Position start) throws IOException, SyntaxError {
        char c = buffer.crntChar();
        if (!buffer.peekEof()) {
            String pair = String.valueOf(c) + buffer.peekChar();
            SymbolType type = OPERATORS.get(pair);
            if (type != null) {
                buffer.nextChar();
                buffer.nextChar();
                return new Token(type, pair, start);
            }
        }
        SymbolType type = OPERATORS.get(String.valueOf(c));
        if (type == null) {
            throw new SyntaxError(start, "unrecognized symbol: '" + c + "'");
        }
        buffer.nextChar();
        return new Token(type, String.valueOf(c), start);
    }

    /* Helper method for string, character literals and comments.
     * Returns the characters up to the first unescaped end character and consumes that character.
     */
    private String nextBlock(char endChar, Position start) throws IOException, SyntaxError {
        StringBuilder builder = new StringBuilder();
        buffer.nextChar(); // opening character
        while (true) {
            if (buffer.eof()) {
                throw new SyntaxError(start, "unterminated block, expected closing " + endChar);
            }
            char c = buffer.crntChar();
            if (c == endChar) break;
            if (c == '\\') {
                buffer.nextChar();
                if (buffer.eof()) {
                    throw new SyntaxError(start, "unterminated block, expected closing " + endChar);
                }
                builder.append(unescape(buffer.crntChar()));
            } else {
                builder.append(c);
            }
            buffer.nextChar();
        }
        buffer.nextChar(); // closing character
        return builder.toString();
    }

    private static char unescape(char c) {
        return switch (c) {
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            case '0' -> '\0';
            default -> c;
        };
    }
}
