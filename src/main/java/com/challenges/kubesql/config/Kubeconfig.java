package com.challenges.kubesql.config;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * The parts of a kubeconfig kubesql cares about.
 *
 * @param contexts       context names in file order
 * @param currentContext value of {@code current-context}, may be {@code null}
 */
public record Kubeconfig(ImmutableList<String> contexts, String currentContext) {

    public boolean hasContext(String name) {
        return contexts.contains(name);
    }

    /**
     * Merges two kubeconfigs the way kubectl merges a KUBECONFIG path list:
     * the first file to set a value wins.
     */
    public Kubeconfig merge(Kubeconfig other) {
        ImmutableList<String> merged = contexts.newWithAll(other.contexts.reject(contexts::contains));
        return new Kubeconfig(merged, currentContext != null ? currentContext : other.currentContext);
    }
}
