package com.challenges.kubesql.query;

/**
 * One field comparison on a resource kind, e.g. {@code pod.status.phase = 'Running'}.
 *
 * @param chainOp      operator joining this clause to the previous one, {@code null} for the chain head
 * @param resourceKind first identifier segment, e.g. {@code pod}
 * @param fieldPath1   second identifier segment
 * @param fieldPath2   third identifier segment
 * @param comparator   comparison operator
 * @param literal      right-hand value with escaped hyphens restored
 */
public record Clause(Operator chainOp, String resourceKind, String fieldPath1, String fieldPath2,
                     Operator comparator, String literal) {

    public Clause withChainOp(Operator op) {
        return new Clause(op, resourceKind, fieldPath1, fieldPath2, comparator, literal);
    }

    public boolean isChainHead() {
        return chainOp == null;
    }

    public String fieldPath() {
        return fieldPath1 + "." + fieldPath2;
    }
}
