package com.challenges.kubesql.query;

import net.sf.jsqlparser.expression.BinaryExpression;
import net.sf.jsqlparser.expression.operators.conditional.AndExpression;
import net.sf.jsqlparser.expression.operators.conditional.OrExpression;
import net.sf.jsqlparser.expression.operators.relational.EqualsTo;
import net.sf.jsqlparser.expression.operators.relational.GreaterThan;
import net.sf.jsqlparser.expression.operators.relational.GreaterThanEquals;
import net.sf.jsqlparser.expression.operators.relational.MinorThan;
import net.sf.jsqlparser.expression.operators.relational.MinorThanEquals;
import net.sf.jsqlparser.expression.operators.relational.NotEqualsTo;

/**
 * Binary operators a WHERE tree may use, either as a clause comparator or as the
 * operator chaining two clauses.
 */
public enum Operator {
    EQUALS("="),
    NOT_EQUALS("!="),
    GREATER_THAN(">"),
    GREATER_THAN_EQUALS(">="),
    MINOR_THAN("<"),
    MINOR_THAN_EQUALS("<="),
    AND("AND"),
    OR("OR");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static Operator of(BinaryExpression expression) throws UnsupportedSyntaxException {
        // NotEqualsTo covers both != and <>
        if (expression instanceof EqualsTo) {
            return EQUALS;
        }
        if (expression instanceof NotEqualsTo) {
            return NOT_EQUALS;
        }
        if (expression instanceof GreaterThanEquals) {
            return GREATER_THAN_EQUALS;
        }
        if (expression instanceof GreaterThan) {
            return GREATER_THAN;
        }
        if (expression instanceof MinorThanEquals) {
            return MINOR_THAN_EQUALS;
        }
        if (expression instanceof MinorThan) {
            return MINOR_THAN;
        }
        if (expression instanceof AndExpression) {
            return AND;
        }
        if (expression instanceof OrExpression) {
            return OR;
        }
        throw new UnsupportedSyntaxException("operator " + expression.getStringExpression());
    }
}
