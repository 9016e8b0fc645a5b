package com.challenges.kubesql.execution;

import com.challenges.kubesql.query.Clause;
import com.challenges.kubesql.query.Operator;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Renders the clauses of one resource kind as Kubernetes {@code --field-selector} strings.
 * <p>
 * A field selector can only AND its terms, so every clause chained with OR starts a new
 * selector; the caller issues one list request per selector and unions the results.
 */
public final class FieldSelectors {
    private FieldSelectors() {
    }

    public static ImmutableList<String> render(ImmutableList<Clause> clauses) throws PlanExecutionException {
        MutableList<String> selectors = Lists.mutable.empty();
        StringBuilder current = new StringBuilder();

        for (Clause clause : clauses) {
            if (clause.chainOp() == Operator.OR && current.length() > 0) {
                selectors.add(current.toString());
                current.setLength(0);
            }
            if (current.length() > 0) {
                current.append(',');
            }
            current.append(term(clause));
        }

        if (current.length() > 0) {
            selectors.add(current.toString());
        }
        return selectors.toImmutable();
    }

    static String term(Clause clause) throws PlanExecutionException {
        String comparator = switch (clause.comparator()) {
            case EQUALS -> "=";
            case NOT_EQUALS -> "!=";
            default -> throw new PlanExecutionException("Field selectors do not support the '"
                    + clause.comparator().symbol() + "' comparator: " + clause.resourceKind() + "."
                    + clause.fieldPath());
        };
        return clause.fieldPath() + comparator + clause.literal();
    }
}
