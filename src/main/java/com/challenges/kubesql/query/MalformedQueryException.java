package com.challenges.kubesql.query;

/**
 * The query text is not valid SQL at all.
 */
public class MalformedQueryException extends TranslationException {
    public MalformedQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
