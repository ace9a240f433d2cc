package com.viffx.Fsm.Compiler;

import com.viffx.Fsm.Ast.ProgramScope;
import com.viffx.Fsm.Grammar.Grammar;
import com.viffx.Fsm.Grammar.Production;
import com.viffx.Fsm.Logging;
import com.viffx.Fsm.Symbols.SymbolType;
import org.apache.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.Iterator;
import java.util.List;
import java.util.Stack;

/**
 * Table driven shift/reduce parser producing a {@link ProgramScope}.
 * <p>
 * The state and value stacks live only for the duration of one {@link #parse} call, so a
 * parser can be shared between threads.
 */
public class Parser {
    private static final Logger LOG = Logging.getLogger();

    private final ParserOptions options;
    private final ParseTable table;
    private final SemanticActions actions;

    public Parser() {
        this(ParserOptions.defaults());
    }

    public Parser(@NotNull ParserOptions options) {
        this.options = options;
        this.table = options.table();
        this.actions = SemanticActions.forGrammar(table.grammar());
    }

    public ParserOptions options() {
        return options;
    }

    /**
     * Tokenizes and parses source text.
     *
     * @throws SyntaxError at the first character sequence or token that does not fit the grammar
     */
    public ProgramScope parse(@NotNull String source) throws SyntaxError {
        return parse(Lexer.tokenize(source));
    }

    /**
     * Parses a token list. Comments are skipped; an end of input token is appended when the
     * list does not end with one. Tokens may come from any lexer, so their values are checked
     * before they are shifted.
     *
     * @throws SyntaxError at the first token the table has no action for, the first token whose
     *                     value is malformed, or a token following an end of input token
     */
    public ProgramScope parse(@NotNull List<Token> tokens) throws SyntaxError {
        Grammar grammar = table.grammar();
        Stack<Integer> stack = new Stack<>();
        Stack<Object> values = new Stack<>();
        stack.push(0);

        Iterator<Token> input = tokens.iterator();
        Token current = next(input, Position.START);

        while (true) {
            int state = stack.peek();
            int symbol = table.symbolIndex(state, current);
            Action action = symbol < 0 ? null : table.action(state, symbol);
            if (action == null) {
                throw new SyntaxError(current, table.expected(state));
            }

            switch (action.type()) {
                case SHIFT -> {
                    if (options.traceActions()) LOG.debug("Shift: " + current + " -> " + action.data());
                    stack.push(action.data());
                    values.push(current);
                    current = next(input, current.position());
                }
                case REDUCE -> {
                    Production production = grammar.production(action.data());
                    Object[] children = new Object[production.size()];
                    for (int i = children.length - 1; i >= 0; i--) {
                        children[i] = values.pop();
                        stack.pop();
                    }
                    values.push(actions.reduce(action.data(), children));
                    if (options.traceActions()) {
                        LOG.debug("Reduce: " + grammar.toString(production) + " @" + production.action());
                    }

                    // Now do GOTO based on state under top
                    Action jump = table.action(stack.peek(), production.lhs());
                    if (jump == null || jump.type() != ActionType.GOTO) {
                        throw new IllegalStateException("state " + stack.peek() + " has no goto for " + grammar.symbol(production.lhs()));
                    }
                    stack.push(jump.data());
                }
                case ACCEPT -> {
                    if (options.traceActions()) LOG.debug("Accept");
                    return (ProgramScope) actions.reduce(action.data(), new Object[]{values.pop()});
                }
                default -> throw new IllegalStateException("Unexpected action " + action + " in state " + state);
            }
        }
    }

    // next significant token, an end of input token once the list runs out
    private static Token next(Iterator<Token> input, Position last) throws SyntaxError {
        while (input.hasNext()) {
            Token token = input.next();
            if (token.type() == SymbolType.COMMENT) {
                last = token.position();
                continue;
            }
            if (token.isEof()) {
                checkNothingFollows(input);
            } else {
                checkValue(token);
            }
            return token;
        }
        return Token.eof(last);
    }

    private static void checkNothingFollows(Iterator<Token> input) throws SyntaxError {
        while (input.hasNext()) {
            Token token = input.next();
            if (token.type() != SymbolType.COMMENT) {
                throw new SyntaxError(token, "unexpected " + token + " after the end of input");
            }
        }
    }

    // wildcard terminals accept any value, the reductions rely on these
    private static void checkValue(Token token) throws SyntaxError {
        String value = token.value();
        if (value == null) {
            throw new SyntaxError(token, token.type() + " token without a value");
        }
        switch (token.type()) {
            case CHR -> {
                if (value.length() != 1) {
                    throw new SyntaxError(token, "a character literal must hold exactly one character, got " + token);
                }
            }
            case NUM -> {
                if (value.isEmpty() || !value.chars().allMatch(Character::isDigit)) {
                    throw new SyntaxError(token, "not an integer literal: " + token);
                }
                try {
                    Long.parseLong(value);
                } catch (NumberFormatException e) {
                    throw new SyntaxError(token, "integer literal out of range: " + token);
                }
            }
            case CMP, LOGIC -> {
                if (!Lexer.isOperator(token.type(), value)) {
                    throw new SyntaxError(token, "unknown operator " + token);
                }
            }
            default -> {
                if (value.isEmpty() && token.type() != SymbolType.STR) {
                    throw new SyntaxError(token, token.type() + " token without a value");
                }
            }
        }
    }
}
