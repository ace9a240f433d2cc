package com.viffx.Fsm.Ast;

import com.viffx.Fsm.Ast.AlphabetConstructor.DescribeConstructor;
import com.viffx.Fsm.Ast.AlphabetConstructor.DescribeEntry;
import com.viffx.Fsm.Ast.AlphabetConstructor.StrictConstructor;

import java.util.List;

/**
 * Renders a syntax tree as indented text, one node per line.
 * <pre>
 * Automaton A : Automaton = Gen.(Bits)
 *     start_state:
 *         start (START)
 *             'a' -> S1
 * </pre>
 * Declarations are separated by an empty line. Tabs are used for indentation.
 */
public final class AstPrinter {
    private final StringBuilder builder = new StringBuilder();

    private AstPrinter() {}

    public static String print(ProgramScope program) {
        AstPrinter printer = new AstPrinter();
        List<Declaration> declarations = program.declarations();
        for (int i = 0; i < declarations.size(); i++) {
            if (i > 0) printer.builder.append('\n');
            printer.declaration(declarations.get(i));
        }
        return printer.builder.toString();
    }

    private void declaration(Declaration declaration) {
        if (declaration instanceof Alphabet alphabet) {
            alphabet(alphabet);
        } else if (declaration instanceof Automaton automaton) {
            automaton(automaton);
        } else if (declaration instanceof ClassDefinition definition) {
            classDefinition(definition);
        } else {
            throw new IllegalArgumentException("Unknown declaration " + declaration);
        }
    }

    private void alphabet(Alphabet alphabet) {
        line(0, "Alphabet " + alphabet.name() + " : " + alphabet.declaredType());
        AlphabetConstructor constructor = alphabet.constructor();
        String generator = "";
        if (constructor instanceof StrictConstructor strict) generator = " " + strict.generator();
        if (constructor instanceof DescribeConstructor describe) generator = " " + describe.generator();
        line(1, "constructor_type: " + constructor.type() + generator);
        line(1, "constructor_params:");
        for (Object param : constructor.params()) {
            if (param instanceof DescribeEntry entry) {
                line(2, terms(entry.terms()) + " from " + entry.source());
            } else {
                line(2, String.valueOf(param));
            }
        }
    }

    private void automaton(Automaton automaton) {
        line(0, "Automaton " + automaton.name() + " : " + automaton.declaredType()
                + " = " + automaton.generator() + ".(" + automaton.alphabetName() + ")");
        AutomatonBody body = automaton.body();
        line(1, "start_state:");
        state(body.startState());
        line(1, "regular_states:");
        body.regularStates().forEach(this::state);
        line(1, "terminal_states:");
        body.terminalStates().forEach(this::state);
    }

    private void state(AutomatonState state) {
        line(2, state.name() + " (" + state.kind() + ")");
        for (Transition transition : state.transitions()) {
            line(3, transition.toString());
        }
    }

    private void classDefinition(ClassDefinition definition) {
        line(0, "ClassDefinition " + definition.className() + " : " + definition.inheritedFrom());
        line(1, "params:");
        for (ClassField field : definition.params()) {
            line(2, field(field));
        }
        line(1, "methods:");
        for (ClassMethod method : definition.methods()) {
            StringBuilder signature = new StringBuilder(method.name()).append('(');
            for (int i = 0; i < method.fields().size(); i++) {
                if (i > 0) signature.append(", ");
                signature.append(field(method.fields().get(i)));
            }
            signature.append(") : ").append(method.returnType());
            line(2, signature.toString());
            line(3, "return " + method.operations());
        }
    }

    private static String field(ClassField field) {
        String text = field.name() + " : " + field.fieldType();
        return field.defaultValue() == null ? text : text + " = " + field.defaultValue();
    }

    private static String terms(List<Term> terms) {
        StringBuilder text = new StringBuilder("(");
        for (int i = 0; i < terms.size(); i++) {
            if (i > 0) text.append(", ");
            text.append(terms.get(i));
        }
        return text.append(')').toString();
    }

    private void line(int depth, String text) {
        builder.append("\t".repeat(depth)).append(text).append('\n');
    }
}
