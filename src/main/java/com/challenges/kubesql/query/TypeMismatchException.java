package com.challenges.kubesql.query;

/**
 * Two folded operands have no combination rule, e.g. a clause compared to a string.
 */
public class TypeMismatchException extends TranslationException {
    private final PlanValue.Kind leftKind;
    private final PlanValue.Kind rightKind;

    public TypeMismatchException(PlanValue.Kind leftKind, PlanValue.Kind rightKind) {
        super("Type mismatch L: " + leftKind + ", R: " + rightKind + "!");
        this.leftKind = leftKind;
        this.rightKind = rightKind;
    }

    public PlanValue.Kind leftKind() {
        return leftKind;
    }

    public PlanValue.Kind rightKind() {
        return rightKind;
    }
}
