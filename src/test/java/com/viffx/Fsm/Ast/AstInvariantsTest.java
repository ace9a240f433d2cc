package com.viffx.Fsm.Ast;

import com.viffx.Fsm.Ast.AlphabetConstructor.EnumerationConstructor;
import com.viffx.Fsm.Ast.Term.CharLiteral;
import com.viffx.Fsm.Ast.Term.Identifier;
import com.viffx.Fsm.Ast.Term.IntLiteral;
import com.viffx.Fsm.Ast.Term.Variable;
import com.viffx.Fsm.Ast.Transition.KeywordTransition;
import com.viffx.Fsm.Ast.Transition.TermTransition;
import com.viffx.Fsm.Ast.TransitionTarget.KeywordTarget;
import com.viffx.Fsm.Ast.TransitionTarget.StateTarget;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class AstInvariantsTest {
    private static final Transition ELSE_ITSELF =
            new KeywordTransition(TransitionKeyword.ELSE, new KeywordTarget(TransitionKeyword.ITSELF));
    private static final CompareOperation COMPARE =
            new CompareOperation(new FieldAccess("a", "x"), CompareOperator.EQUAL, new FieldAccess("b", "y"));

    @Test(expected = IllegalArgumentException.class)
    public void testStateNeedsTransitions() {
        new AutomatonState("s1", StateKind.REGULAR, List.of());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testStartNameIsReserved() {
        new AutomatonState(AutomatonState.START_STATE_NAME, StateKind.REGULAR, List.of(ELSE_ITSELF));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testStartStateHasTheReservedName() {
        new AutomatonState("s0", StateKind.START, List.of(ELSE_ITSELF));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBodyChecksStateKinds() {
        AutomatonState terminal = new AutomatonState("t", StateKind.TERMINAL, List.of(ELSE_ITSELF));
        new AutomatonBody(AutomatonState.start(List.of(ELSE_ITSELF)), List.of(terminal), List.of());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTermTransitionNeedsConcreteTerm() {
        new TermTransition(new Identifier("x"), new StateTarget("s1"));
    }

    @Test
    public void testTermTransitionAcceptsVariables() {
        Transition transition = new TermTransition(new Variable("P", List.of(new Identifier("x"))), new StateTarget("s1"));
        assertEquals("P(x) -> s1", transition.toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFieldDefaultMustBeConcrete() {
        new ClassField("f", "T", new Identifier("x"));
    }

    @Test
    public void testFieldDefaultIsOptional() {
        assertFalse(new ClassField("f", "T", null).defaultTerm().isPresent());
        assertEquals(new IntLiteral(3), new ClassField("f", "T", new IntLiteral(3)).defaultTerm().get());
    }

    @Test
    public void testLogicChainAlternates() {
        new LogicOperations(List.of(COMPARE, LogicOperator.AND, COMPARE));
        try {
            new LogicOperations(List.of(COMPARE, LogicOperator.AND));
            fail("chain ending with an operator accepted");
        } catch (IllegalArgumentException expected) {
            assertTrue(expected.getMessage().contains("odd"));
        }
        try {
            new LogicOperations(List.of(COMPARE, COMPARE, COMPARE));
            fail("comparisons without operator accepted");
        } catch (IllegalArgumentException expected) {
            assertTrue(expected.getMessage().contains("logic operator"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testProgramIsNotEmpty() {
        new ProgramScope(List.of());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testVariableHasArguments() {
        new Variable("A", List.of());
    }

    @Test
    public void testListsAreCopied() {
        List<Term> terms = new ArrayList<>(List.of(new CharLiteral('a')));
        Alphabet alphabet = new Alphabet("s", "Alphabet", new EnumerationConstructor(terms));
        terms.add(new CharLiteral('b'));
        assertEquals(1, alphabet.constructorParams().size());

        ProgramScope program = new ProgramScope(List.of(alphabet));
        try {
            program.declarations().add(alphabet);
            fail("declarations are mutable");
        } catch (UnsupportedOperationException expected) {
            assertEquals(1, program.declarations().size());
        }
    }

    @Test
    public void testOperatorsAndKeywords() {
        assertEquals(CompareOperator.LESS_OR_EQUAL, CompareOperator.fromSymbol("<="));
        assertEquals(LogicOperator.OR, LogicOperator.fromSymbol("||"));
        assertEquals(TransitionKeyword.DEADEND, TransitionKeyword.fromKeyword("deadend"));
        assertEquals("itself", TransitionKeyword.ITSELF.keyword());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownKeyword() {
        TransitionKeyword.fromKeyword("start");
    }

    @Test
    public void testNestedVariableText() {
        Term term = new Variable("A", List.of(new Variable("B", List.of(new IntLiteral(1), new CharLiteral('c')))));
        assertEquals("A(B(1, 'c'))", term.toString());
        assertEquals("a.x == b.y && a.x == b.y",
                new LogicOperations(List.of(COMPARE, LogicOperator.AND, COMPARE)).toString());
    }
}
