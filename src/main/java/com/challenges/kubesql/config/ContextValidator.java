package com.challenges.kubesql.config;

import org.eclipse.collections.api.list.ImmutableList;

public final class ContextValidator {
    private ContextValidator() {
    }

    /**
     * Fails with every requested context that the kubeconfig does not define.
     */
    public static void validateContexts(Kubeconfig kubeconfig, ImmutableList<String> contexts)
            throws ContextNotFoundException {
        ImmutableList<String> notFound = contexts.reject(kubeconfig::hasContext);
        if (notFound.notEmpty()) {
            throw new ContextNotFoundException(notFound);
        }
    }
}
