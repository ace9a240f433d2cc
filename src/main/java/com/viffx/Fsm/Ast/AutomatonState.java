package com.viffx.Fsm.Ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

public record AutomatonState(String name, StateKind kind, List<Transition> transitions) {
    /**
     * The name given to every start state. It is a keyword, so no declared state can clash with it.
     */
    public static final String START_STATE_NAME = "start";

    public AutomatonState {
        checkNotNull(name, "name");
        checkNotNull(kind, "kind");
        transitions = ImmutableList.copyOf(transitions);
        checkArgument(!transitions.isEmpty(), "state %s has no transitions", name);
        checkArgument((kind == StateKind.START) == START_STATE_NAME.equals(name),
                "only the start state is named %s", START_STATE_NAME);
    }

    public static AutomatonState start(List<Transition> transitions) {
        return new AutomatonState(START_STATE_NAME, StateKind.START, transitions);
    }
}
