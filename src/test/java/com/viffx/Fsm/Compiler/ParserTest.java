package com.viffx.Fsm.Compiler;

import com.viffx.Fsm.Ast.*;
import com.viffx.Fsm.Ast.AlphabetConstructor.DescribeEntry;
import com.viffx.Fsm.Ast.Term.CharLiteral;
import com.viffx.Fsm.Ast.Term.Identifier;
import com.viffx.Fsm.Ast.Term.IntLiteral;
import com.viffx.Fsm.Ast.Term.StringLiteral;
import com.viffx.Fsm.Ast.Term.Variable;
import com.viffx.Fsm.Ast.Transition.KeywordTransition;
import com.viffx.Fsm.Ast.Transition.TermTransition;
import com.viffx.Fsm.Ast.TransitionTarget.KeywordTarget;
import com.viffx.Fsm.Ast.TransitionTarget.StateTarget;
import com.viffx.Fsm.Grammar.Grammar;
import com.viffx.Fsm.Symbols.SymbolType;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static com.viffx.Fsm.Symbols.SymbolType.*;
import static org.junit.Assert.*;

public class ParserTest {
    private static final Parser PARSER = new Parser();

    private static final String AUTOMATON =
            "def d : Automaton = Gen.(bits).{\n" +
            "    start 'a' -> s1 'b' -> s2\n" +
            "    s1 else -> s1\n" +
            "    s2 deadend -> itself 1 -> s1\n" +
            "    terminal {\n" +
            "        s3 alphabet -> s1\n" +
            "        s4 \"word\" -> s3\n" +
            "    }\n" +
            "}\n";

    private static final String CLASS =
            "class Point(x : Int, y : Int = 0, z : Pair = Pair(1, 'c')) : Base {\n" +
            "    override fun near(p : Point, q : Point) : Bool {\n" +
            "        return (p.x == q.x || (p.y < q.y) && (p.z != q.z))\n" +
            "    }\n" +
            "    override fun far(p : Point) : Bool { return ((p.x >= q.x)) }\n" +
            "}\n";

    private static ProgramScope parse(String source) throws SyntaxError {
        return PARSER.parse(source);
    }

    private static Alphabet alphabet(String source) throws SyntaxError {
        ProgramScope program = parse(source);
        assertEquals(1, program.alphabets().size());
        return program.alphabets().get(0);
    }

    private static SyntaxError syntaxError(String source) {
        try {
            parse(source);
        } catch (SyntaxError e) {
            return e;
        }
        throw new AssertionError("Parsed without error: " + source);
    }

    private static SyntaxError tokenError(List<Token> tokens) {
        try {
            PARSER.parse(tokens);
        } catch (SyntaxError e) {
            return e;
        }
        throw new AssertionError("Parsed without error: " + tokens);
    }

    // def s : Alphabet = { <value> }, the value being the seventh token
    private static List<Token> enumerationOf(SymbolType type, String value) {
        return tokens(KEY, "def", ID, "s", SYM, ":", TYPE, "Alphabet", SYM, "=", SYM, "{", type, value, SYM, "}");
    }

    private static void assertMalformed(SymbolType type, String value) {
        List<Token> tokens = enumerationOf(type, value);
        SyntaxError error = tokenError(tokens);
        assertEquals(type + "(" + value + ")", tokens.get(6), error.token());
        assertEquals(new Position(1, 7), error.position());
        assertTrue(error.expected().isEmpty());
    }

    // line 1, columns counted per token so that errors have distinct positions
    private static List<Token> tokens(Object... typesAndValues) {
        List<Token> tokens = new ArrayList<>();
        for (int i = 0; i < typesAndValues.length; i += 2) {
            tokens.add(new Token((SymbolType) typesAndValues[i], (String) typesAndValues[i + 1], new Position(1, i / 2 + 1)));
        }
        return tokens;
    }

    @Test
    public void testDeclarationCountAndOrder() throws SyntaxError {
        ProgramScope program = parse(
                "def bits : Alphabet = { 'a', 'b' }\n" + AUTOMATON + CLASS +
                "def more : Alphabet = Gen.(1, 2)\n");
        assertEquals(4, program.declarations().size());
        assertTrue(program.declarations().get(0) instanceof Alphabet);
        assertTrue(program.declarations().get(1) instanceof Automaton);
        assertTrue(program.declarations().get(2) instanceof ClassDefinition);
        assertTrue(program.declarations().get(3) instanceof Alphabet);
        assertEquals(List.of("bits", "d", "Point", "more"),
                program.declarations().stream().map(Declaration::name).toList());
        assertEquals(2, program.alphabets().size());
        assertEquals(1, program.automata().size());
        assertEquals(1, program.classes().size());
    }

    @Test
    public void testEnumerationAlphabet() throws SyntaxError {
        Alphabet alphabet = alphabet("def s : Alphabet = { 'a','b' }");
        assertEquals("s", alphabet.name());
        assertEquals("Alphabet", alphabet.declaredType());
        assertEquals(ConstructorType.ENUMERATION, alphabet.constructorType());
        assertEquals(List.of(new CharLiteral('a'), new CharLiteral('b')), alphabet.constructorParams());
    }

    @Test
    public void testStrictAlphabet() throws SyntaxError {
        Alphabet alphabet = alphabet("def s : Alphabet = Gen.(1,2)");
        assertEquals(ConstructorType.STRICT, alphabet.constructorType());
        assertEquals(List.of(new IntLiteral(1), new IntLiteral(2)), alphabet.constructorParams());
        assertEquals("Gen", ((AlphabetConstructor.StrictConstructor) alphabet.constructor()).generator());
    }

    @Test
    public void testStrictAlphabetWithSingleIdentifier() throws SyntaxError {
        Alphabet alphabet = alphabet("def s : Alphabet = Gen.(x)");
        assertEquals(ConstructorType.STRICT, alphabet.constructorType());
        assertEquals(List.of(new Identifier("x")), alphabet.constructorParams());

        alphabet = alphabet("def s : Alphabet = Gen.(x, \"y\", z)");
        assertEquals(List.of(new Identifier("x"), new StringLiteral("y"), new Identifier("z")), alphabet.constructorParams());

        alphabet = alphabet("def s : Alphabet = Gen.('q')");
        assertEquals(List.of(new CharLiteral('q')), alphabet.constructorParams());
    }

    @Test
    public void testDescribeAlphabet() throws SyntaxError {
        Alphabet alphabet = alphabet("def s : Alphabet = Gen.{ (1,2) from x }");
        assertEquals(ConstructorType.DESCRIBE, alphabet.constructorType());
        assertEquals(List.of(new DescribeEntry(List.of(new IntLiteral(1), new IntLiteral(2)), "x")),
                alphabet.constructorParams());

        alphabet = alphabet("def s : Alphabet = Gen.{ 1, 2 from x, 'c' from y }");
        assertEquals(List.of(
                new DescribeEntry(List.of(new IntLiteral(1), new IntLiteral(2)), "x"),
                new DescribeEntry(List.of(new CharLiteral('c')), "y")), alphabet.constructorParams());
    }

    @Test
    public void testNestedVariables() throws SyntaxError {
        Alphabet alphabet = alphabet("def s : Alphabet = { A(B(C(1))) }");
        Variable a = (Variable) alphabet.constructorParams().get(0);
        assertEquals("A", a.vartype());
        assertEquals(1, a.params().size());
        Variable b = (Variable) a.params().get(0);
        assertEquals("B", b.vartype());
        assertEquals(1, b.params().size());
        Variable c = (Variable) b.params().get(0);
        assertEquals("C", c.vartype());
        assertEquals(List.of(new IntLiteral(1)), c.params());
    }

    @Test
    public void testAutomatonBody() throws SyntaxError {
        Automaton automaton = parse(AUTOMATON).automata().get(0);
        assertEquals("d", automaton.name());
        assertEquals("Automaton", automaton.declaredType());
        assertEquals("Gen", automaton.generator());
        assertEquals("bits", automaton.alphabetName());

        AutomatonBody body = automaton.body();
        AutomatonState start = body.startState();
        assertEquals(StateKind.START, start.kind());
        assertEquals(AutomatonState.START_STATE_NAME, start.name());
        assertEquals(List.of(
                new TermTransition(new CharLiteral('a'), new StateTarget("s1")),
                new TermTransition(new CharLiteral('b'), new StateTarget("s2"))), start.transitions());

        assertEquals(List.of("s1", "s2"), body.regularStates().stream().map(AutomatonState::name).toList());
        assertEquals(List.of("s3", "s4"), body.terminalStates().stream().map(AutomatonState::name).toList());
        for (AutomatonState state : body.regularStates()) {
            assertEquals(StateKind.REGULAR, state.kind());
            assertFalse(state.transitions().isEmpty());
        }
        for (AutomatonState state : body.terminalStates()) {
            assertEquals(StateKind.TERMINAL, state.kind());
        }

        assertEquals(List.of(
                new KeywordTransition(TransitionKeyword.DEADEND, new KeywordTarget(TransitionKeyword.ITSELF)),
                new TermTransition(new IntLiteral(1), new StateTarget("s1"))), body.regularStates().get(1).transitions());
        assertEquals(List.of(new KeywordTransition(TransitionKeyword.ALPHABET, new StateTarget("s1"))),
                body.terminalStates().get(0).transitions());
        assertEquals(List.of(new TermTransition(new StringLiteral("word"), new StateTarget("s3"))),
                body.terminalStates().get(1).transitions());
    }

    @Test
    public void testStartStateIsUnique() throws SyntaxError {
        AutomatonBody body = parse(AUTOMATON).automata().get(0).body();
        long starts = body.regularStates().stream().filter(s -> s.kind() == StateKind.START).count()
                + body.terminalStates().stream().filter(s -> s.kind() == StateKind.START).count();
        assertEquals(0, starts);
    }

    @Test
    public void testEmptyStateLists() throws SyntaxError {
        AutomatonBody body = parse("def d : Automaton = Gen.(bits).{ start else -> deadend terminal { } }")
                .automata().get(0).body();
        assertTrue(body.regularStates().isEmpty());
        assertTrue(body.terminalStates().isEmpty());
        assertEquals(List.of(new KeywordTransition(TransitionKeyword.ELSE, new KeywordTarget(TransitionKeyword.DEADEND))),
                body.startState().transitions());
    }

    @Test
    public void testVariableTransitionTerm() throws SyntaxError {
        AutomatonState start = parse("def d : Automaton = Gen.(bits).{ start Pair(1, x) -> s terminal { s 'a' -> s } }")
                .automata().get(0).body().startState();
        Transition transition = start.transitions().get(0);
        assertEquals(new TermTransition(new Variable("Pair", List.of(new IntLiteral(1), new Identifier("x"))),
                new StateTarget("s")), transition);
    }

    @Test
    public void testNestedVariablesAgreeAcrossTermPositions() throws SyntaxError {
        Term nested = new Variable("A", List.of(new Variable("B", List.of(new Variable("C", List.of(new IntLiteral(1)))))));

        assertEquals(List.of(nested), alphabet("def s : Alphabet = { A(B(C(1))) }").constructorParams());

        AutomatonState start = parse("def d : Automaton = Gen.(bits).{ start A(B(C(1))) -> s terminal { s 'a' -> s } }")
                .automata().get(0).body().startState();
        assertEquals(List.of(new TermTransition(nested, new StateTarget("s"))), start.transitions());

        ClassField field = parse("class C(f : T = A(B(C(1)))) : P { override fun m(a : T) : Bool { return (a.x == b.y) } }")
                .classes().get(0).params().get(0);
        assertEquals(nested, field.defaultValue());
    }

    @Test
    public void testTwoStateAutomatonFromTokens() throws SyntaxError {
        List<Token> tokens = new ArrayList<>(tokens(
                KEY, "def", ID, "d", SYM, ":", TYPE, "Automaton", SYM, "=",
                TYPE, "Gen", SYM, ".", SYM, "(", ID, "bits", SYM, ")", SYM, ".", SYM, "{"));
        tokens.addAll(tokens(
                KEY, "start", CHR, "a", SYM, "->", ID, "S1",
                ID, "S1", KEY, "else", SYM, "->", ID, "S1",
                KEY, "terminal", SYM, "{", ID, "S1", CHR, "b", SYM, "->", ID, "S1", SYM, "}",
                SYM, "}"));

        ProgramScope program = PARSER.parse(tokens);
        assertEquals(1, program.declarations().size());
        AutomatonBody body = program.automata().get(0).body();

        assertEquals(1, body.regularStates().size());
        assertEquals("S1", body.regularStates().get(0).name());
        assertEquals(List.of(new KeywordTransition(TransitionKeyword.ELSE, new StateTarget("S1"))),
                body.regularStates().get(0).transitions());

        assertEquals(1, body.terminalStates().size());
        assertEquals("S1", body.terminalStates().get(0).name());
        assertEquals(List.of(new TermTransition(new CharLiteral('b'), new StateTarget("S1"))),
                body.terminalStates().get(0).transitions());

        assertEquals(List.of(new TermTransition(new CharLiteral('a'), new StateTarget("S1"))),
                body.startState().transitions());
    }

    @Test
    public void testClassDefinition() throws SyntaxError {
        ClassDefinition definition = parse(CLASS).classes().get(0);
        assertEquals("Point", definition.className());
        assertEquals("Base", definition.inheritedFrom());

        assertEquals(List.of(
                new ClassField("x", "Int", null),
                new ClassField("y", "Int", new IntLiteral(0)),
                new ClassField("z", "Pair", new Variable("Pair", List.of(new IntLiteral(1), new CharLiteral('c'))))),
                definition.params());

        assertEquals(2, definition.methods().size());
        ClassMethod near = definition.methods().get(0);
        assertEquals("near", near.name());
        assertEquals("Bool", near.returnType());
        assertEquals(List.of(new ClassField("p", "Point", null), new ClassField("q", "Point", null)), near.fields());
    }

    @Test
    public void testLogicChain() throws SyntaxError {
        ClassMethod near = parse(CLASS).classes().get(0).methods().get(0);
        LogicOperations operations = near.operations();
        assertEquals(5, operations.elements().size());
        assertEquals(List.of(LogicOperator.OR, LogicOperator.AND), operations.operators());

        CompareOperation first = operations.comparisons().get(0);
        assertEquals(new FieldAccess("p", "x"), first.left());
        assertEquals(CompareOperator.EQUAL, first.operator());
        assertEquals(new FieldAccess("q", "x"), first.right());
        assertEquals(CompareOperator.LESS, operations.comparisons().get(1).operator());
        assertEquals(CompareOperator.NOT_EQUAL, operations.comparisons().get(2).operator());

        ClassMethod far = parse(CLASS).classes().get(0).methods().get(1);
        assertEquals("Parentheses around a chain are dropped",
                List.of(new CompareOperation(new FieldAccess("p", "x"), CompareOperator.GREATER_OR_EQUAL, new FieldAccess("q", "x"))),
                far.operations().elements());
    }

    @Test
    public void testFieldAccessMatchesSource() throws SyntaxError {
        ClassMethod method = parse(
                "class C(f : T) : P { override fun m(a : T) : Bool { return (a.x == b.y) } }")
                .classes().get(0).methods().get(0);
        CompareOperation compare = method.operations().comparisons().get(0);
        assertEquals("a", compare.left().belongsTo());
        assertEquals("x", compare.left().name());
        assertEquals("b", compare.right().belongsTo());
        assertEquals("y", compare.right().name());
    }

    @Test
    public void testCommentsAreSkipped() throws SyntaxError {
        ProgramScope program = parse("# letters # def s : Alphabet = { 'a' # only one # }");
        assertEquals(List.of(new CharLiteral('a')), program.alphabets().get(0).constructorParams());
    }

    @Test
    public void testMissingTerminalBlock() {
        SyntaxError error = syntaxError("def d : Automaton = Gen.(bits).{ start 'a' -> s1 }");
        assertNotNull(error.token());
        assertEquals("}", error.token().value());
        assertTrue(error.expected().toString(), error.expected().contains("'terminal'"));
    }

    @Test
    public void testStateWithoutTransitions() {
        SyntaxError error = syntaxError("def d : Automaton = Gen.(bits).{ start 'a' -> s1 s2 terminal { } }");
        assertEquals("terminal", error.token().value());
        assertTrue(error.expected().toString(), error.expected().contains("'else'"));

        error = syntaxError("def d : Automaton = Gen.(bits).{ start 'a' -> s1 terminal { s3 } }");
        assertEquals("}", error.token().value());

        error = syntaxError("def d : Automaton = Gen.(bits).{ start terminal { } }");
        assertEquals("terminal", error.token().value());
    }

    @Test
    public void testIdentifierIsNotATransitionTerm() {
        SyntaxError error = syntaxError("def d : Automaton = Gen.(bits).{ start a -> s1 terminal { } }");
        assertEquals(new Token(ID, "a", new Position(1, 40)), error.token());
    }

    @Test
    public void testErrorPositionAndMessage() {
        SyntaxError error = syntaxError("def s : Alphabet = {\n  'a',\n  }");
        assertEquals(new Position(3, 3), error.position());
        assertEquals(List.of("CHR", "ID", "NUM", "STR", "TYPE"), error.expected());
        assertTrue(error.getMessage(), error.getMessage().startsWith("3:3: unexpected SYM(}), expected one of ["));
    }

    @Test
    public void testEmptyInput() {
        SyntaxError error = syntaxError("");
        assertTrue(error.token().isEof());
        assertEquals(List.of("'class'", "'def'"), error.expected());
        assertEquals("1:1: unexpected end of input, expected one of ['class', 'def']", error.getMessage());
    }

    @Test
    public void testUnexpectedEndOfInput() {
        SyntaxError error = syntaxError("def s : Alphabet = { 'a'");
        assertTrue(error.token().isEof());
        assertTrue(error.expected().toString(), error.expected().containsAll(List.of("','", "'}'")));
        assertFalse(error.expected().contains("end of input"));
    }

    @Test
    public void testLexicalErrorsAreSyntaxErrors() {
        SyntaxError error = syntaxError("def s : Alphabet = { $ }");
        assertNull(error.token());
        assertEquals(new Position(1, 22), error.position());
    }

    @Test
    public void testTokenListWithoutEndOfInput() throws SyntaxError {
        List<Token> tokens = tokens(KEY, "def", ID, "s", SYM, ":", TYPE, "Alphabet", SYM, "=", SYM, "{", NUM, "7", SYM, "}");
        assertEquals(List.of(new IntLiteral(7)), PARSER.parse(tokens).alphabets().get(0).constructorParams());
    }

    @Test
    public void testMalformedTokenValues() throws SyntaxError {
        assertMalformed(NUM, "99999999999999999999");
        assertMalformed(NUM, "-1");
        assertMalformed(NUM, "");
        assertMalformed(CHR, "");
        assertMalformed(CHR, "ab");
        assertMalformed(ID, null);
        assertMalformed(ID, "");
        assertMalformed(STR, null);

        // an empty string is a value of its own
        assertEquals(List.of(new StringLiteral("")),
                PARSER.parse(enumerationOf(STR, "")).alphabets().get(0).constructorParams());
    }

    @Test
    public void testUnknownOperators() throws SyntaxError {
        List<Token> tokens = Lexer.tokenize(
                "class C(f : T) : P { override fun m(a : T) : Bool { return (a.x == b.y && (a.z < b.z)) } }");
        for (SymbolType type : List.of(CMP, LOGIC)) {
            List<Token> altered = new ArrayList<>(tokens);
            int index = altered.stream().map(Token::type).toList().indexOf(type);
            Token operator = new Token(type, "=~", altered.get(index).position());
            altered.set(index, operator);

            SyntaxError error = tokenError(altered);
            assertEquals(operator, error.token());
            assertEquals(operator.position(), error.position());
        }
    }

    @Test
    public void testTokensAfterEndOfInput() throws SyntaxError {
        List<Token> tokens = tokens(KEY, "def", ID, "s", SYM, ":", TYPE, "Alphabet", SYM, "=", SYM, "{", NUM, "7", SYM, "}",
                SymbolType.EOF, null, SYM, "}", SYM, "}");
        SyntaxError error = tokenError(tokens);
        assertEquals(tokens.get(9), error.token());
        assertEquals(new Position(1, 10), error.position());

        tokens = tokens(KEY, "def", ID, "s", SYM, ":", TYPE, "Alphabet", SYM, "=", SYM, "{", NUM, "7", SYM, "}",
                SymbolType.EOF, null, COMMENT, "trailing");
        assertEquals(List.of(new IntLiteral(7)), PARSER.parse(tokens).alphabets().get(0).constructorParams());
    }

    @Test
    public void testExplicitTable() throws Exception {
        ParseTable table = ParseTable.build(Grammar.load(ParseTable.GRAMMAR_RESOURCE));
        Parser parser = new Parser(ParserOptions.defaults().withTable(table));
        assertSame(table, parser.options().table());
        assertEquals(parse(AUTOMATON), parser.parse(AUTOMATON));
    }

    @Test
    public void testParserIsReusable() throws SyntaxError {
        Parser parser = new Parser(ParserOptions.defaults().withTraceActions(true));
        assertEquals(parser.parse(AUTOMATON), parser.parse(AUTOMATON));
        assertEquals(parse(CLASS), parser.parse(CLASS));
    }
}
