package com.viffx.Fsm.Grammar;

import java.util.ArrayList;
import java.util.List;

/**
 * The right hand side of one grammar alternative as symbol indices, together with its
 * left hand side and the name of the semantic action that reduces it.
 */
public class Production extends ArrayList<Integer> {
    private final int lhs;
    private final String action;

    public Production(int lhs, String action) {
        this.lhs = lhs;
        this.action = action;
    }

    public int lhs() {
        return lhs;
    }

    public String action() {
        return action;
    }

    public boolean atEnd(int dot) {
        return dot >= size();
    }

    /**
     * Returns the symbols after the one at {@code dot}.
     *
     * @param dot a dot position before the end of the production
     * @return the remaining symbols, empty if the symbol at {@code dot} is the last one
     */
    public List<Integer> beta(int dot) {
        dot++;
        if (atEnd(dot)) return List.of();

        // return a new list containing RHS indices after the dot
        return new ArrayList<>(subList(dot, size()));
    }

    @Override
    public String toString() {
        return "Production{" +
                "lhs=" + lhs +
                ", action=" + action +
                ", elements=" + super.toString() +
                '}';
    }
}
