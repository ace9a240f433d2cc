package com.viffx.Fsm.Ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A value written in the source: a literal, a bare identifier or a constructed value.
 * <p>
 * Transition symbols and field defaults only accept concrete terms, that is every
 * variant except {@link Identifier}.
 */
public sealed interface Term {

    /**
     * @return {@code false} only for bare identifiers, whose value depends on a later lookup
     */
    default boolean isConcrete() {
        return true;
    }

    // inverse of the lexer's escapes, keeps a dump line free of control characters
    private static String escape(String text, char quote) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\n' -> escaped.append("\\n");
                case '\t' -> escaped.append("\\t");
                case '\r' -> escaped.append("\\r");
                case '\0' -> escaped.append("\\0");
                case '\\' -> escaped.append("\\\\");
                default -> {
                    if (c == quote) escaped.append('\\');
                    escaped.append(c);
                }
            }
        }
        return escaped.toString();
    }

    record CharLiteral(char value) implements Term {
        @Override
        public String toString() {
            return "'" + Term.escape(String.valueOf(value), '\'') + "'";
        }
    }

    record IntLiteral(long value) implements Term {
        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    record StringLiteral(String value) implements Term {
        public StringLiteral {
            checkNotNull(value, "value");
        }

        @Override
        public String toString() {
            return '"' + Term.escape(value, '"') + '"';
        }
    }

    record Identifier(String name) implements Term {
        public Identifier {
            checkNotNull(name, "name");
        }

        @Override
        public boolean isConcrete() {
            return false;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A constructed value {@code Type(arg, arg, ...)}; arguments nest to any depth.
     */
    record Variable(String vartype, List<Term> params) implements Term {
        public Variable {
            checkNotNull(vartype, "vartype");
            params = ImmutableList.copyOf(params);
            checkArgument(!params.isEmpty(), "%s is constructed without arguments", vartype);
        }

        @Override
        public String toString() {
            StringBuilder builder = new StringBuilder(vartype).append('(');
            for (int i = 0; i < params.size(); i++) {
                if (i > 0) builder.append(", ");
                builder.append(params.get(i));
            }
            return builder.append(')').toString();
        }
    }
}
