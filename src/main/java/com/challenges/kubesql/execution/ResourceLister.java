package com.challenges.kubesql.execution;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * Lists the names of resources matching a field selector in one context and namespace.
 */
public interface ResourceLister {
    ImmutableList<String> list(String context, String namespace, ResourceKind kind, String fieldSelector)
            throws PlanExecutionException;
}
