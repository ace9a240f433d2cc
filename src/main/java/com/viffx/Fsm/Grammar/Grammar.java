package com.viffx.Fsm.Grammar;

import com.viffx.Fsm.Compiler.Item;
import com.viffx.Fsm.Symbols.NonTerminal;
import com.viffx.Fsm.Symbols.Symbol;
import com.viffx.Fsm.Symbols.SymbolType;
import com.viffx.Fsm.Symbols.Terminal;
import com.viffx.Fsm.Utils.LexicalCharacterBuffer;
import org.jetbrains.annotations.NotNull;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.function.Consumer;

import static java.lang.Character.isLetterOrDigit;
import static java.lang.Character.isWhitespace;

/**
 * A context free grammar compiled into integer tables.
 * <p>
 * Grammars are read from definitions of the form
 * <pre>
 *   # comment
 *   START > program @accept;
 *   program > declaration @first | program declaration @append;
 *   declaration > KEY(def) ID() SYM(;) @definition | EPSILON() @nothing;
 * </pre>
 * Terminals are written {@code TYPE(value)} where {@code TYPE} is a lexical {@link SymbolType};
 * an empty value matches every token of that type. {@code EPSILON()} marks an empty alternative.
 * Every alternative names the semantic action that reduces it.
 * <p>
 * A loaded grammar is never modified and may be shared between threads.
 */
public class Grammar {
    // ====== INSTANCE FIELDS ====== //
    // Symbols fields
    private boolean startDefined = false;
    private final Symbol[] symbols;
    private final boolean[] isNonTerminal;
    private final int[] nonTerminals;
    private final Map<Terminal, Integer> terminals = new HashMap<>();
    private int EPSILON;
    private int EOF;
    private int TEST;
    private int START;

    // Productions fields
    private final List<int[]> productionRanges = new ArrayList<>();
    private final List<Production> productions = new ArrayList<>();

    // Lexing fields
    private final String name;
    private final LexicalCharacterBuffer lexer;
    private int numRules = 0;
    private int index = 0;
    private final List<GrammarToken> currentRule = new ArrayList<>();

    // ====== CONSTRUCTORS ====== //
    private Grammar(String name, Reader source) throws IOException {
        this.name = name;
        lexer = new LexicalCharacterBuffer(source);

        ParseResult parseResult = parseRules();
        if (!startDefined) throw new GrammarException(name + ": the NonTerminal START is never defined");
        checkForUndefinedNonTerminals(parseResult);

        SymbolProcessingResult symbolProcessingResult = processSymbols(parseResult.symbolsMap);
        symbols = symbolProcessingResult.symbols;
        isNonTerminal = symbolProcessingResult.isNonTerminal;
        nonTerminals = symbolProcessingResult.nonTerminals;

        // properly pad the pointers so that they can be indexed by symbol
        for (int symbol = 0; symbol < symbols.length; symbol++) {
            int[] range = parseResult.ranges.get(symbol);
            productionRanges.add(range == null ? new int[]{0, 0} : range);
        }

        // eliminate epsilons, truly empty productions are left without symbols
        for (int i = 0; i < productions.size(); i++) {
            Production production = productions.get(i);
            Production replacement = new Production(production.lhs(), production.action());
            for (int symbol : production) {
                if (symbol != EPSILON) replacement.add(symbol);
            }
            productions.set(i, replacement);
        }
    }

    /**
     * Loads a grammar from the class path.
     *
     * @param resource the resource name, relative to the class path root
     * @return the compiled grammar
     * @throws IOException if the resource is missing or is not a valid grammar
     */
    public static Grammar load(@NotNull String resource) throws IOException {
        InputStream stream = Grammar.class.getClassLoader().getResourceAsStream(resource);
        if (stream == null) throw new FileNotFoundException("Grammar resource not found: " + resource);
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            return new Grammar(resource, reader);
        }
    }

    /**
     * Compiles a grammar definition held in a string.
     *
     * @param definition the grammar definition
     * @return the compiled grammar
     * @throws GrammarException if the definition is not a valid grammar
     */
    public static Grammar parse(@NotNull String definition) throws GrammarException {
        try {
            return new Grammar("<string>", new StringReader(definition));
        } catch (GrammarException e) {
            throw e;
        } catch (IOException e) {
            throw new GrammarException("Reading the grammar definition failed: " + e.getMessage());
        }
    }

    // ====== PUBLIC API ====== //

    // Items

    /**
     * Returns if the the input {@code item} is at or beyond the end of the production it references
     *
     * @param item the grammar item whose dot position is inspected
     * @return if the item's dot is at or beyond the end of the production it references
     * @throws NullPointerException if {@code item} is {@code null}
     */
    public boolean atEnd(Item item) {
        Objects.requireNonNull(item, "item cannot be null");
        return item.dot() >= productions.get(item.index()).size();
    }

    /**
     * Returns the grammar symbol index at the current dot position of the given item.
     *
     * @param item the grammar item whose dot position is inspected
     * @return the symbol index at the dot position
     * @throws IndexOutOfBoundsException if the dot position is equal to or greater than the production size
     * @throws NullPointerException if {@code item} is {@code null}
     */
    public int symbol(Item item) {
        Objects.requireNonNull(item, "item cannot be null");

        Production production = productions.get(item.index());
        if (atEnd(item)) {
            throwIndexOutOfBoundsException(item.dot(), production.size());
        }
        return production.get(item.dot());
    }

    /**
     * Returns the symbol indexes after the symbol at the dot of the production that {@code item} references
     *
     * @param item the grammar item whose dot position is inspected
     * @return the symbol indexes after the symbol directly after the dot, possibly none
     * @throws NullPointerException if {@code item} is {@code null}
     */
    public List<Integer> beta(Item item) {
        Objects.requireNonNull(item, "item cannot be null");
        return productions.get(item.index()).beta(item.dot());
    }

    /**
     * Returns a string representation of the given grammar {@link Item}, for example
     * <pre>
     *   E > E • SYM(+) T, [EOF($)];
     * </pre>
     *
     * @param item the grammar item to represent as a string
     * @return a human-readable string showing the production and dot position
     */
    public String toString(Item item) {
        if (item == null) return "null";
        Production production = productions.get(item.index());

        StringBuilder builder = new StringBuilder();
        builder.append(symbols[production.lhs()]);
        builder.append(" >");

        for (int i = 0; i < production.size(); i++) {
            if (i == item.dot()) builder.append(" •");
            builder.append(" ").append(symbols[production.get(i)]);
        }

        if (production.isEmpty()) builder.append(" EPSILON()");
        if (production.size() <= item.dot()) builder.append(" •");

        if (item.lookahead() != null) {
            builder.append(", [").append(symbols[item.lookahead()]).append("]");
        }
        builder.append(";");

        return builder.toString();
    }

    // Productions

    /**
     * Returns a string representation of the given {@link Production}:
     * <pre>
     *   A > B C D;
     * </pre>
     *
     * @param production the grammar production to represent as a string
     * @return a human-readable string showing the production rule
     */
    public String toString(Production production) {
        StringBuilder builder = new StringBuilder();
        builder.append(symbols[production.lhs()]);
        builder.append(" > ");

        if (production.isEmpty()) {
            builder.append("EPSILON();");
            return builder.toString();
        }

        for (int i = 0; i < production.size(); i++) {
            builder.append(symbols[production.get(i)]);
            if (i + 1 < production.size()) builder.append(" ");
        }
        builder.append(";");

        return builder.toString();
    }

    // Grammar - Symbol Access

    /**
     * Resolves a symbol index to its corresponding {@link Symbol} object.
     *
     * @param symbol the integer index of the symbol
     * @return the {@link Symbol} corresponding to the index
     */
    public Symbol symbol(int symbol) {
        return symbols[symbol];
    }

    /**
     * Returns the index of a terminal, or {@code -1} if the grammar does not use it.
     * <p>
     * Terminals with a value are looked up exactly; use {@link Terminal#wildcard()} to find
     * the terminal that matches every token of a type.
     *
     * @param terminal the terminal to look up
     * @return its symbol index or {@code -1}
     */
    public int indexOf(Terminal terminal) {
        return terminals.getOrDefault(terminal, -1);
    }

    /**
     * Returns whether the {@code symbol} index inputted corresponds to a non-terminal
     *
     * @param symbol the integer index of the symbol
     * @return if the input symbol index is a non-terminal
     */
    public boolean isNonTerminal(int symbol) {
        return isNonTerminal[symbol];
    }

    /**
     * Returns the total number of grammar symbols (both terminals and non-terminals).
     *
     * @return the number of symbols in the grammar
     */
    public int symbolCount() {
        return symbols.length;
    }

    public void forEachNonTerminal(Consumer<Integer> consumer) {
        for (int nonTerminal : nonTerminals) {
            consumer.accept(nonTerminal);
        }
    }

    // Grammar - Production Access

    /**
     * Resolves a production index to its corresponding {@link Production} object.
     *
     * @param production the integer index of the production
     * @return the {@link Production} corresponding to the index
     */
    public Production production(int production) {
        return productions.get(production);
    }

    /**
     * Returns the total number of productions in the grammar.
     *
     * @return the number of productions
     */
    public int productionsCount() {
        return productions.size();
    }

    public void forEachProduction(Consumer<Production> consumer) {
        productions.forEach(consumer);
    }

    /**
     * Applies the given {@link Consumer} action to each production index
     * associated with a specific non-terminal.
     * <p>
     * Each non-terminal has a range of productions stored in {@code productionRanges},
     * where {@code data[0]} is the start index (inclusive) and {@code data[1]} is the end index (exclusive).
     *
     * @param nonTerminal the non-terminal whose productions to iterate over
     * @param consumer a function to process each production index belonging to that non-terminal
     */
    public void forEachProduction(int nonTerminal, Consumer<Integer> consumer) {
        int[] data = productionRanges.get(nonTerminal);
        for (int i = data[0]; i < data[1]; i++) {
            consumer.accept(i);
        }
    }

    /**
     * Returns the range of productions associated with the specified non-terminal as
     * {@code [start, end)}.
     *
     * @param nonTerminal the non-terminal whose production range is requested
     * @return a two-element array containing the start and end indices (inclusive/exclusive)
     * @throws IndexOutOfBoundsException if {@code nonTerminal} is invalid
     */
    public int[] productionRanges(int nonTerminal) {
        return productionRanges.get(nonTerminal).clone();
    }

    // Grammar - Special Symbols

    /**
     * @return the index of the {@code EPSILON} symbol, the empty production
     */
    public int EPSILON() {
        return EPSILON;
    }

    /**
     * @return the index of the {@code EOF} symbol, which marks the end of the token stream
     */
    public int EOF() {
        return EOF;
    }

    /**
     * @return the index of the {@code TEST} symbol, the placeholder lookahead used to
     * discover propagated lookaheads while building the parse table
     */
    public int TEST() {
        return TEST;
    }

    /**
     * @return the index of the {@code START} non-terminal from which parsing begins
     */
    public int START() {
        return START;
    }

    /**
     * @return the index of the single production of {@code START}
     */
    public int startProduction() {
        return productionRanges.get(START)[0];
    }

    public String name() {
        return name;
    }

    private static void throwIndexOutOfBoundsException(int index, int size) {
        throw new IndexOutOfBoundsException(
                String.format("Index %d out of bounds for length %d",
                        index,
                        size
                )
        );
    }

    // ====== INTERNAL DATA TYPES ====== //
    private record ParseResult(Map<GrammarToken, Integer> symbolsMap, Set<GrammarToken> defined, Map<Integer, int[]> ranges) {}
    private record SymbolProcessingResult(Symbol[] symbols, boolean[] isNonTerminal, int[] nonTerminals) {}

    // ====== PARSING METHODS ====== //

    // Repeatedly call the parseRule method until all the rules have been parsed
    private ParseResult parseRules() throws IOException {
        Map<GrammarToken, Integer> symbols = new LinkedHashMap<>();
        Set<GrammarToken> defined = new HashSet<>();
        Map<Integer, int[]> ranges = new HashMap<>();
        while (true) {
            ignoreWhiteSpace();

            // break if after absorbing white space we reach the end of the file
            if (lexer.eof()) break;

            defined.add(parseRule(symbols, defined, ranges));
        }
        return new ParseResult(symbols, defined, ranges);
    }

    /**
     * Parses a single grammar rule and updates the symbol and production tables accordingly.
     * <p>
     * A rule such as
     * <pre>
     *   NonTerminal1 > NonTerminal2 ID() @first | NonTerminal3 @second;
     * </pre>
     * assigns each new symbol the next free index and appends one {@link Production} per
     * alternative. The productions of a rule are contiguous, so the rule is recorded as the
     * range of production indices it occupies.
     * <p>
     * The method also enforces the following constraints:
     * <ul>
     *   <li>A non-terminal is defined by exactly one rule.</li>
     *   <li>The {@code START} non-terminal must have exactly one production with exactly one symbol.</li>
     *   <li>{@code START} never appears on a right hand side.</li>
     *   <li>Every alternative ends with an action name.</li>
     * </ul>
     *
     * @return the {@link GrammarToken} representing the left-hand side non-terminal of the parsed rule
     * @throws GrammarException if the grammar rule is malformed, violates constraints, or the file ends unexpectedly
     */
    private GrammarToken parseRule(Map<GrammarToken, Integer> symbols, Set<GrammarToken> defined, Map<Integer, int[]> ranges) throws IOException {
        // update and reset parsing state
        numRules++;
        currentRule.clear();

        // ------ Parse the non-terminal declaration (left hand side) ------ //
        GrammarToken leftHandSide = expect(GrammarToken.Type.NON_TERMINAL, null);
        if (GrammarToken.START.equals(leftHandSide)) {
            if (startDefined) throw new GrammarException(errorContext() + "The NonTerminal START can only be defined once.");
            startDefined = true;
        }
        if (defined.contains(leftHandSide)) throw new GrammarException(errorContext() + "nonTerminal: " + leftHandSide + " is already defined");

        int lhs = symbols.computeIfAbsent(leftHandSide, ignored -> symbols.size());
        expect(GrammarToken.Type.SYMBOL, ">");

        // ------ parse the right hand side ------ //
        int from = productions.size();
        label:
        while (true) {
            List<Integer> rightHandSide = new ArrayList<>();
            GrammarToken current = next();
            while (current.type() == GrammarToken.Type.TERMINAL || current.type() == GrammarToken.Type.NON_TERMINAL) {
                if (GrammarToken.START.equals(current)) {
                    throw new GrammarException(errorContext() + "The NonTerminal START cannot be part of any right hand side.");
                }
                rightHandSide.add(symbols.computeIfAbsent(current, ignored -> symbols.size()));
                current = next();
            }

            if (current.type() == GrammarToken.Type.EOF) throw new GrammarException(errorContext() + "Reached end of file while defining a non terminal");
            if (current.type() != GrammarToken.Type.ACTION) throw new GrammarException(errorContext() + "Unexpected symbol: " + current + ", every alternative must end with an @action");
            if (rightHandSide.isEmpty()) throw new GrammarException(errorContext() + "Empty alternative, write EPSILON() instead");

            Production production = new Production(lhs, current.value());
            production.addAll(rightHandSide);
            productions.add(production);

            // A ";" or a "|" must follow the action
            current = next();
            if (current.isSymbol(";")) break label;
            if (current.isSymbol("|")) continue;
            if (current.isSymbol(">")) throw new GrammarException(errorContext() + "MISSING SEMICOLON");
            throw new GrammarException(errorContext() + "Expected ';' or '|' after an action, got " + current);
        }

        int to = productions.size();
        if (GrammarToken.START.equals(leftHandSide)) {
            if (to - from != 1) throw new GrammarException(errorContext() + "The NonTerminal START must have only one production.");
            if (productions.get(from).size() != 1) throw new GrammarException(errorContext() + "The NonTerminal START may only have one symbol in the right hand side.");
        }
        ranges.put(lhs, new int[]{from, to});

        return leftHandSide;
    }

    // ====== SYMBOL FINALIZATION ====== //
    // register special symbols and finalize the symbols data structure by reducing them to arrays
    private SymbolProcessingResult processSymbols(Map<GrammarToken, Integer> symbolsMap) {
        EPSILON = symbolsMap.computeIfAbsent(GrammarToken.terminal(SymbolType.EPSILON, null), ignored -> symbolsMap.size());
        TEST = symbolsMap.computeIfAbsent(GrammarToken.terminal(SymbolType.TEST, "#"), ignored -> symbolsMap.size());
        EOF = symbolsMap.computeIfAbsent(GrammarToken.terminal(SymbolType.EOF, "$"), ignored -> symbolsMap.size());

        Symbol[] symbols = new Symbol[symbolsMap.size()];
        boolean[] isNonTerminal = new boolean[symbolsMap.size()];
        int[] nonTerminals = new int[symbolsMap.size()];
        int nonTerminalCount = 0;
        for (GrammarToken token : symbolsMap.keySet()) {
            int index = symbolsMap.get(token);
            Symbol symbol = token.decompose();
            symbols[index] = symbol;
            isNonTerminal[index] = token.type() == GrammarToken.Type.NON_TERMINAL;
            if (symbol instanceof Terminal terminal) {
                terminals.put(terminal, index);
            } else {
                nonTerminals[nonTerminalCount++] = index;
                if (symbol.equals(NonTerminal.START)) START = index;
            }
        }

        // shorten the nonTerminals array to the proper length
        return new SymbolProcessingResult(symbols, isNonTerminal, Arrays.copyOf(nonTerminals, nonTerminalCount));
    }

    // find all used non-terminals that are not defined and notify the user
    private void checkForUndefinedNonTerminals(ParseResult parseResult) throws GrammarException {
        List<String> undefined = new ArrayList<>();
        for (GrammarToken symbol : parseResult.symbolsMap.keySet()) {
            if (symbol.type() != GrammarToken.Type.NON_TERMINAL) continue;
            if (!parseResult.defined.contains(symbol)) undefined.add(symbol.value());
        }
        if (!undefined.isEmpty())
            throw new GrammarException(name + ": the following nonTerminals are undefined in the input grammar: " + undefined);
    }

    // ====== LEXICAL UTILITIES ====== //
    private void ignoreWhiteSpace() throws IOException {
        while (!lexer.eof()) {
            char c = lexer.crntChar();
            if (c == '#') {
                // comments run to the end of the line
                lexer.takeWhile(ch -> ch != '\n');
            } else if (isWhitespace(c)) {
                lexer.nextChar();
            } else {
                break;
            }
        }
    }

    /**
     * Reads and returns the next {@link GrammarToken} from the grammar input stream.
     * <p>
     * Skips whitespace and comments, detects grammar punctuation ('>', '|', ';'), action
     * names ({@code @name}), non-terminal names and terminal declarations of the form
     * {@code TYPE(value)}. The value {@code )} is written {@code TYPE())}.
     *
     * @return the next token from the grammar input, or {@code GrammarToken.EOF} if end-of-file is reached
     * @throws GrammarException if an unknown symbol or malformed token is encountered
     */
    private GrammarToken next() throws IOException {
        ignoreWhiteSpace();
        if (lexer.eof()) return GrammarToken.EOF;
        index++;

        // Detect a grammar symbol
        char c = lexer.crntChar();
        if (c == '>' || c == '|' || c == ';') {
            lexer.nextChar();
            GrammarToken token = GrammarToken.symbol(c);
            currentRule.add(token);
            return token;
        }
        if (c == '@') {
            lexer.nextChar();
            GrammarToken token = GrammarToken.action(readName());
            if (token.value().isEmpty()) throw new GrammarException(errorContext() + "missing action name after '@'");
            currentRule.add(token);
            return token;
        }
        if (!isLetterOrDigit(c) && c != '_') throw new GrammarException(errorContext() + "unknown symbol: " + c);

        // Read the name of the token
        String name = readName();

        // decide if the token is a nonTerminal or a terminal
        // if it's a terminal then the name is its type
        if (lexer.eof() || lexer.crntChar() != '(') {
            GrammarToken token = GrammarToken.nonTerminal(name);
            currentRule.add(token);
            return token;
        }

        // Check that the user entered a valid type name
        SymbolType type;
        try {
            type = SymbolType.valueOf(name);
        } catch (IllegalArgumentException e) {
            throw new GrammarException(errorContext() + "illegal terminal type: " + name);
        }
        if (!type.isLexical() && type != SymbolType.EPSILON) {
            throw new GrammarException(errorContext() + "illegal terminal type: " + name);
        }

        // parse the value field of the terminal
        StringBuilder builder = new StringBuilder();
        lexer.nextChar(); // '('
        if (!lexer.eof() && lexer.crntChar() == ')' && lexer.peekChar() == ')') {
            builder.append(lexer.nextChar());
        } else {
            while (!lexer.eof() && lexer.crntChar() != ')') {
                builder.append(lexer.crntChar());
                lexer.nextChar();
            }
        }
        if (lexer.eof()) throw new GrammarException(errorContext() + "expected ')' got EOF");
        lexer.nextChar(); // ')'

        // handle the wild card terminal declaration
        String value = builder.toString();
        value = value.isEmpty() || type == SymbolType.EPSILON ? null : value;

        GrammarToken token = GrammarToken.terminal(type, value);
        currentRule.add(token);
        return token;
    }

    private String readName() throws IOException {
        return lexer.takeWhile(c -> isLetterOrDigit(c) || c == '_');
    }

    private GrammarToken expect(GrammarToken.Type type, String expectedValue) throws IOException {
        GrammarToken token = next();
        if (token.type() == type && (expectedValue == null || expectedValue.equals(token.value()))) return token;
        throw new GrammarException(errorContext() + "EXPECTED: " + type + "(" + (expectedValue == null ? "" : expectedValue) + ") GOT: " + token);
    }

    // ====== DEBUG / ERROR REPORTING ====== //
    private String errorContext() {
        return "\n\tERROR: " + name + " Rule:" + numRules + " Index: " + index +
                "\n\tCONTEXT: " + currentRule +
                "\n\tBuffer: " + lexer.buffer() + "\n\t";
    }
}
