package com.challenges.kubesql.query;

import com.challenges.kubesql.KubeSqlException;

/**
 * Raised when a SQL sentence cannot be translated into a {@link QueryPlan}.
 */
public abstract class TranslationException extends KubeSqlException {
    protected TranslationException(String message) {
        super(message);
    }

    protected TranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
