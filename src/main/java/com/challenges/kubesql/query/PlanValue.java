package com.challenges.kubesql.query;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Intermediate result of folding a WHERE expression.
 */
public sealed interface PlanValue {
    enum Kind {
        STRING_LIST,
        STRING_SCALAR,
        CLAUSE,
        CLAUSE_CHAIN
    }

    Kind kind();

    /** Segments of a dotted identifier such as {@code pod.status.phase}. */
    record StringList(ImmutableList<String> segments) implements PlanValue {
        @Override
        public Kind kind() {
            return Kind.STRING_LIST;
        }
    }

    record StringScalar(String value) implements PlanValue {
        @Override
        public Kind kind() {
            return Kind.STRING_SCALAR;
        }
    }

    record ClauseValue(Clause clause) implements PlanValue {
        @Override
        public Kind kind() {
            return Kind.CLAUSE;
        }
    }

    record ClauseChain(ImmutableList<Clause> clauses) implements PlanValue {
        public static ClauseChain of(Clause head, Clause next) {
            return new ClauseChain(Lists.immutable.of(head, next));
        }

        public ClauseChain append(Clause clause) {
            return new ClauseChain(clauses.newWith(clause));
        }

        @Override
        public Kind kind() {
            return Kind.CLAUSE_CHAIN;
        }
    }
}
