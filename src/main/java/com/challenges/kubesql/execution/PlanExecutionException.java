package com.challenges.kubesql.execution;

import com.challenges.kubesql.KubeSqlException;

public class PlanExecutionException extends KubeSqlException {
    public PlanExecutionException(String message) {
        super(message);
    }

    public PlanExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
