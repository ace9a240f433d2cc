package com.viffx.Fsm.Ast;

import com.viffx.Fsm.Ast.TransitionTarget.StateTarget;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An edge leaving the state it is declared in.
 * <p>
 * Only a keyword-keyed transition may lead to a keyword; a term-keyed transition
 * always names its destination state.
 */
public sealed interface Transition {

    TransitionTarget stateTo();

    /**
     * {@code term -> State}
     */
    record TermTransition(Term symbolBy, StateTarget stateTo) implements Transition {
        public TermTransition {
            checkNotNull(symbolBy, "symbolBy");
            checkArgument(symbolBy.isConcrete(), "a transition is keyed by a concrete term, not %s", symbolBy);
            checkNotNull(stateTo, "stateTo");
        }

        @Override
        public String toString() {
            return symbolBy + " -> " + stateTo;
        }
    }

    /**
     * {@code keyword -> State} or {@code keyword -> keyword}
     */
    record KeywordTransition(TransitionKeyword symbolBy, TransitionTarget stateTo) implements Transition {
        public KeywordTransition {
            checkNotNull(symbolBy, "symbolBy");
            checkNotNull(stateTo, "stateTo");
        }

        @Override
        public String toString() {
            return symbolBy + " -> " + stateTo;
        }
    }
}
