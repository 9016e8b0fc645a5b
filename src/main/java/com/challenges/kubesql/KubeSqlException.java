package com.challenges.kubesql;

/**
 * Base type of every error kubesql reports to the user.
 */
public class KubeSqlException extends Exception {
    public KubeSqlException(String message) {
        super(message);
    }

    public KubeSqlException(String message, Throwable cause) {
        super(message, cause);
    }
}
