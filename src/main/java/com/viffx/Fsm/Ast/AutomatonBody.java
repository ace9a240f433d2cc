package com.viffx.Fsm.Ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The states of an automaton. Regular and terminal states keep their declaration order.
 */
public record AutomatonBody(AutomatonState startState, List<AutomatonState> regularStates, List<AutomatonState> terminalStates) {

    public AutomatonBody {
        checkNotNull(startState, "startState");
        checkArgument(startState.kind() == StateKind.START, "%s is not a start state", startState.name());
        regularStates = ImmutableList.copyOf(regularStates);
        terminalStates = ImmutableList.copyOf(terminalStates);
        for (AutomatonState state : regularStates) {
            checkArgument(state.kind() == StateKind.REGULAR, "%s is listed as a regular state", state.name());
        }
        for (AutomatonState state : terminalStates) {
            checkArgument(state.kind() == StateKind.TERMINAL, "%s is listed as a terminal state", state.name());
        }
    }
}
