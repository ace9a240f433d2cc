package com.viffx.Fsm.Ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A boolean expression flattened into {@code comparison (operator comparison)*}.
 * <p>
 * There is no operator precedence: the chain is evaluated strictly from left to right.
 * Parentheses of the source are not kept.
 */
public record LogicOperations(List<LogicElement> elements) {

    public LogicOperations {
        elements = ImmutableList.copyOf(elements);
        checkArgument(elements.size() % 2 == 1, "a logic chain has an odd number of elements, got %s", elements.size());
        for (int i = 0; i < elements.size(); i++) {
            LogicElement element = elements.get(i);
            if (i % 2 == 0) {
                checkArgument(element instanceof CompareOperation, "element %s must be a comparison, got %s", i, element);
            } else {
                checkArgument(element instanceof LogicOperator, "element %s must be a logic operator, got %s", i, element);
            }
        }
    }

    public ImmutableList<CompareOperation> comparisons() {
        ImmutableList.Builder<CompareOperation> builder = ImmutableList.builder();
        for (int i = 0; i < elements.size(); i += 2) {
            builder.add((CompareOperation) elements.get(i));
        }
        return builder.build();
    }

    public ImmutableList<LogicOperator> operators() {
        ImmutableList.Builder<LogicOperator> builder = ImmutableList.builder();
        for (int i = 1; i < elements.size(); i += 2) {
            builder.add((LogicOperator) elements.get(i));
        }
        return builder.build();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (LogicElement element : elements) {
            if (builder.length() > 0) builder.append(' ');
            builder.append(element);
        }
        return builder.toString();
    }
}
