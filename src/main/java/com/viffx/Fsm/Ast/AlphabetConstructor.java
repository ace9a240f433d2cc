package com.viffx.Fsm.Ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The right hand side of an alphabet declaration, one variant per declaration form.
 */
public sealed interface AlphabetConstructor {

    ConstructorType type();

    List<?> params();

    /**
     * {@code { t, t, ... }}
     */
    record EnumerationConstructor(List<Term> terms) implements AlphabetConstructor {
        public EnumerationConstructor {
            terms = ImmutableList.copyOf(terms);
            checkArgument(!terms.isEmpty(), "an enumeration alphabet lists at least one term");
        }

        @Override
        public ConstructorType type() {
            return ConstructorType.ENUMERATION;
        }

        @Override
        public List<Term> params() {
            return terms;
        }
    }

    /**
     * {@code Generator.( t, t, ... )}
     */
    record StrictConstructor(String generator, List<Term> arguments) implements AlphabetConstructor {
        public StrictConstructor {
            arguments = ImmutableList.copyOf(arguments);
            checkNotNull(generator, "generator");
            checkArgument(!arguments.isEmpty(), "a strict alphabet passes at least one argument");
        }

        @Override
        public ConstructorType type() {
            return ConstructorType.STRICT;
        }

        @Override
        public List<Term> params() {
            return arguments;
        }
    }

    /**
     * {@code Generator.{ t, t from source, ... }}
     */
    record DescribeConstructor(String generator, List<DescribeEntry> entries) implements AlphabetConstructor {
        public DescribeConstructor {
            entries = ImmutableList.copyOf(entries);
            checkNotNull(generator, "generator");
            checkArgument(!entries.isEmpty(), "a describe alphabet has at least one entry");
        }

        @Override
        public ConstructorType type() {
            return ConstructorType.DESCRIBE;
        }

        @Override
        public List<DescribeEntry> params() {
            return entries;
        }
    }

    /**
     * An enumeration of terms taken from the field named {@code source}.
     */
    record DescribeEntry(List<Term> terms, String source) {
        public DescribeEntry {
            terms = ImmutableList.copyOf(terms);
            checkArgument(!terms.isEmpty(), "a describe entry lists at least one term");
            checkNotNull(source, "source");
        }
    }
}
