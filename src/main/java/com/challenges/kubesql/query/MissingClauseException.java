package com.challenges.kubesql.query;

public class MissingClauseException extends TranslationException {
    public enum ClauseKind {
        PROJECTION("SELECT statement is required to call the given namespace(s)!"),
        FROM("FROM statement is required to call the given context(s)!"),
        WHERE("WHERE statement is required in order to set --field-selector!");

        private final String message;

        ClauseKind(String message) {
            this.message = message;
        }
    }

    private final ClauseKind clauseKind;

    public MissingClauseException(ClauseKind clauseKind) {
        super(clauseKind.message);
        this.clauseKind = clauseKind;
    }

    public ClauseKind clauseKind() {
        return clauseKind;
    }
}
