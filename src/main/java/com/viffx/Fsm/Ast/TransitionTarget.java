package com.viffx.Fsm.Ast;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Where a transition leads: a state named in the source or a transition keyword.
 */
public sealed interface TransitionTarget {

    record StateTarget(String name) implements TransitionTarget {
        public StateTarget {
            checkNotNull(name, "name");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record KeywordTarget(TransitionKeyword keyword) implements TransitionTarget {
        public KeywordTarget {
            checkNotNull(keyword, "keyword");
        }

        @Override
        public String toString() {
            return keyword.toString();
        }
    }
}
