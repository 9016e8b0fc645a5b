package com.challenges.kubesql.config;

import com.challenges.kubesql.KubeSqlException;
import org.eclipse.collections.api.list.ImmutableList;

public class ContextNotFoundException extends KubeSqlException {
    private final ImmutableList<String> contexts;

    public ContextNotFoundException(ImmutableList<String> contexts) {
        super("Context not found in your KUBECONFIG: " + contexts.makeString("[", ", ", "]"));
        this.contexts = contexts;
    }

    public ImmutableList<String> contexts() {
        return contexts;
    }
}
