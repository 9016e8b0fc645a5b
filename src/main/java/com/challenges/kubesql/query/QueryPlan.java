package com.challenges.kubesql.query;

import org.eclipse.collections.api.list.ImmutableList;

import java.util.Locale;

/**
 * Result of translating one SQL sentence.
 *
 * @param namespaces namespaces from the projection list, in query order
 * @param contexts   kubeconfig contexts from the FROM list, in query order
 * @param clauses    field-selector clauses from the WHERE tree, in source order
 */
public record QueryPlan(ImmutableList<String> namespaces, ImmutableList<String> contexts,
                        ImmutableList<Clause> clauses) {

    /**
     * Distinct resource kinds referenced by the clauses, lower-cased, in first-appearance order.
     */
    public ImmutableList<String> resourceKinds() {
        return clauses.collect(clause -> clause.resourceKind().toLowerCase(Locale.ROOT)).distinct();
    }

    public ImmutableList<Clause> clausesFor(String resourceKind) {
        return clauses.select(clause -> clause.resourceKind().equalsIgnoreCase(resourceKind));
    }
}
