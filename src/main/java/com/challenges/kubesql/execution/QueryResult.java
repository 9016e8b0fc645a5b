package com.challenges.kubesql.execution;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Resource names found for every (context, namespace, kind) combination of a plan.
 */
public record QueryResult(ImmutableList<String> contexts, ImmutableList<String> namespaces,
                          ImmutableList<ResourceKind> kinds, ImmutableList<QueryResult.ResourceRow> rows) {

    public record ResourceRow(String context, String namespace, ResourceKind kind, ImmutableList<String> names) {
    }

    public ImmutableList<String> names(String context, String namespace, ResourceKind kind) {
        return rows.detectOptional(row -> row.context().equals(context)
                        && row.namespace().equals(namespace)
                        && row.kind() == kind)
                .map(ResourceRow::names)
                .orElse(Lists.immutable.empty());
    }
}
