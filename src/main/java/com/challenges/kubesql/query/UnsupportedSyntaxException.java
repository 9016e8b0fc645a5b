package com.challenges.kubesql.query;

public class UnsupportedSyntaxException extends TranslationException {
    private final String feature;

    public UnsupportedSyntaxException(String feature) {
        super("Unsupported: " + feature);
        this.feature = feature;
    }

    public String feature() {
        return feature;
    }
}
