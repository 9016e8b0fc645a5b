package com.challenges.kubesql.query;

import org.eclipse.collections.api.list.ImmutableList;

public class ArityException extends TranslationException {
    private final ImmutableList<String> segments;

    public ArityException(ImmutableList<String> segments) {
        super("WHERE statement does only support three length identifiers, i.e. 'pod.status.phase', got: "
                + segments.makeString("."));
        this.segments = segments;
    }

    public ImmutableList<String> segments() {
        return segments;
    }
}
