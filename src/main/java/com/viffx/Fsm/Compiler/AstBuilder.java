package com.viffx.Fsm.Compiler;

import com.google.common.collect.ImmutableMap;
import com.viffx.Fsm.Ast.*;
import com.viffx.Fsm.Ast.AlphabetConstructor.DescribeConstructor;
import com.viffx.Fsm.Ast.AlphabetConstructor.DescribeEntry;
import com.viffx.Fsm.Ast.AlphabetConstructor.EnumerationConstructor;
import com.viffx.Fsm.Ast.AlphabetConstructor.StrictConstructor;
import com.viffx.Fsm.Ast.Term.*;
import com.viffx.Fsm.Ast.Transition.KeywordTransition;
import com.viffx.Fsm.Ast.Transition.TermTransition;
import com.viffx.Fsm.Ast.TransitionTarget.KeywordTarget;
import com.viffx.Fsm.Ast.TransitionTarget.StateTarget;
import com.viffx.Fsm.Compiler.SemanticActions.Children;
import com.viffx.Fsm.Compiler.SemanticActions.Elements;
import com.viffx.Fsm.Compiler.SemanticActions.Reduction;

import java.util.List;

import static com.viffx.Fsm.Compiler.SemanticActions.append;
import static com.viffx.Fsm.Compiler.SemanticActions.newList;

/**
 * The reductions of {@code automata.grammar}. Child indices count every right hand side
 * symbol, punctuation included.
 */
final class AstBuilder {
    // def name : Type =
    private record DefinitionHead(String name, String declaredType) {}

    private static final ImmutableMap<String, Reduction> REDUCTIONS = ImmutableMap.<String, Reduction>builder()
            // program
            .put("accept", c -> new ProgramScope(c.list(0, Declaration.class)))
            .put("firstDeclaration", c -> newList(c.get(0, Declaration.class)))
            .put("appendDeclaration", c -> append(c.elements(0), c.get(1, Declaration.class)))
            .put("passThrough", c -> c.get(0))
            .put("definitionHead", c -> new DefinitionHead(c.text(1), c.text(3)))

            // alphabets
            .put("enumerationAlphabet", c -> alphabet(c, new EnumerationConstructor(c.list(2, Term.class))))
            .put("strictIdentifierAlphabet", c -> alphabet(c, new StrictConstructor(c.text(1), List.of(new Identifier(c.text(4))))))
            .put("strictAlphabet", c -> alphabet(c, new StrictConstructor(c.text(1), c.list(4, Term.class))))
            .put("describeAlphabet", c -> alphabet(c, new DescribeConstructor(c.text(1), c.list(4, DescribeEntry.class))))
            .put("identifierFirstArguments", c -> prepend(new Identifier(c.text(0)), c.elements(2)))
            .put("singleArgument", c -> newList(c.get(0, Term.class)))
            .put("concreteFirstArguments", c -> prepend(c.get(0, Term.class), c.elements(2)))
            .put("firstDescribeEntry", c -> newList(c.get(0, DescribeEntry.class)))
            .put("appendDescribeEntry", c -> append(c.elements(0), c.get(2, DescribeEntry.class)))
            .put("describeEntry", c -> new DescribeEntry(c.list(0, Term.class), c.text(2)))
            .put("parenthesizedDescribeEntry", c -> new DescribeEntry(c.list(1, Term.class), c.text(4)))

            // terms
            .put("firstTerm", c -> newList(c.get(0, Term.class)))
            .put("appendTerm", c -> append(c.elements(0), c.get(2, Term.class)))
            .put("identifierTerm", c -> new Identifier(c.text(0)))
            .put("charTerm", c -> new CharLiteral(c.text(0).charAt(0)))
            .put("intTerm", c -> new IntLiteral(Long.parseLong(c.text(0))))
            .put("stringTerm", c -> new StringLiteral(c.text(0)))
            .put("variableTerm", c -> new Variable(c.text(0), c.list(2, Term.class)))

            // automata
            .put("automaton", AstBuilder::automaton)
            .put("automatonBody", c -> new AutomatonBody(AutomatonState.start(c.list(1, Transition.class)),
                    c.list(2, AutomatonState.class), c.list(5, AutomatonState.class)))
            .put("emptyStates", c -> new Elements())
            .put("appendRegularState", c -> append(c.elements(0), new AutomatonState(c.text(1), StateKind.REGULAR, c.list(2, Transition.class))))
            .put("appendTerminalState", c -> append(c.elements(0), new AutomatonState(c.text(1), StateKind.TERMINAL, c.list(2, Transition.class))))
            .put("firstTransition", c -> newList(c.get(0, Transition.class)))
            .put("appendTransition", c -> append(c.elements(0), c.get(1, Transition.class)))
            .put("termTransition", c -> new TermTransition(c.get(0, Term.class), new StateTarget(c.text(2))))
            .put("keywordToStateTransition", c -> new KeywordTransition(c.get(0, TransitionKeyword.class), new StateTarget(c.text(2))))
            .put("keywordToKeywordTransition", c -> new KeywordTransition(c.get(0, TransitionKeyword.class),
                    new KeywordTarget(c.get(2, TransitionKeyword.class))))
            .put("transitionKeyword", c -> TransitionKeyword.fromKeyword(c.text(0)))

            // classes
            .put("classDefinition", c -> new ClassDefinition(c.text(1), c.text(6), c.list(3, ClassField.class), c.list(8, ClassMethod.class)))
            .put("firstField", c -> newList(c.get(0, ClassField.class)))
            .put("appendField", c -> append(c.elements(0), c.get(2, ClassField.class)))
            .put("field", c -> new ClassField(c.text(0), c.text(2), null))
            .put("fieldWithDefault", c -> new ClassField(c.text(0), c.text(2), c.get(4, Term.class)))
            .put("firstMethod", c -> newList(c.get(0, ClassMethod.class)))
            .put("appendMethod", c -> append(c.elements(0), c.get(1, ClassMethod.class)))
            .put("method", c -> new ClassMethod(c.text(2), c.list(4, ClassField.class), c.text(7),
                    new LogicOperations(c.list(11, LogicElement.class))))
            .put("firstComparison", c -> newList(c.get(0, LogicElement.class)))
            .put("parenthesized", c -> c.elements(1))
            .put("appendComparison", AstBuilder::appendComparison)
            .put("compareOperation", c -> new CompareOperation(c.get(0, FieldAccess.class),
                    CompareOperator.fromSymbol(c.text(1)), c.get(2, FieldAccess.class)))
            .put("fieldAccess", c -> new FieldAccess(c.text(0), c.text(2)))
            .build();

    private AstBuilder() {}

    static ImmutableMap<String, Reduction> reductions() {
        return REDUCTIONS;
    }

    private static Alphabet alphabet(Children c, AlphabetConstructor constructor) {
        DefinitionHead head = c.get(0, DefinitionHead.class);
        return new Alphabet(head.name(), head.declaredType(), constructor);
    }

    // head Gen . ( alphabet ) . { body }
    private static Automaton automaton(Children c) {
        DefinitionHead head = c.get(0, DefinitionHead.class);
        return new Automaton(head.name(), head.declaredType(), c.text(1), c.text(4), c.get(8, AutomatonBody.class));
    }

    private static Elements appendComparison(Children c) {
        Elements elements = c.elements(0);
        elements.add(LogicOperator.fromSymbol(c.text(1)));
        elements.add(c.get(3, CompareOperation.class));
        return elements;
    }

    private static Elements prepend(Term first, Elements rest) {
        Elements terms = newList(first);
        terms.addAll(rest);
        return terms;
    }
}
