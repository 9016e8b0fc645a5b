package com.challenges.kubesql.execution;

import java.util.Locale;

/**
 * Resource kinds a WHERE clause can address. Declaration order is the row order of the result table.
 */
public enum ResourceKind {
    POD("pod", "pods"),
    DEPLOYMENT("deployment", "deployments"),
    SERVICE("service", "services");

    private final String singular;
    private final String plural;

    ResourceKind(String singular, String plural) {
        this.singular = singular;
        this.plural = plural;
    }

    public String singular() {
        return singular;
    }

    public String plural() {
        return plural;
    }

    public static ResourceKind of(String name) throws PlanExecutionException {
        String lower = name.toLowerCase(Locale.ROOT);
        for (ResourceKind kind : values()) {
            if (kind.singular.equals(lower)) {
                return kind;
            }
        }
        throw new PlanExecutionException("Unexpected resource kind: " + name);
    }

    @Override
    public String toString() {
        return singular;
    }
}
