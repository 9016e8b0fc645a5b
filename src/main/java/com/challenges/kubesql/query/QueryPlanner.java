package com.challenges.kubesql.query;

import net.sf.jsqlparser.expression.BinaryExpression;
import net.sf.jsqlparser.expression.DateValue;
import net.sf.jsqlparser.expression.DoubleValue;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.HexValue;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.expression.NullValue;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.expression.TimeValue;
import net.sf.jsqlparser.expression.TimestampValue;
import net.sf.jsqlparser.schema.Column;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Arrays;

/**
 * Folds a WHERE expression tree bottom-up into a single {@link PlanValue}.
 * <p>
 * A comparison {@code kind.field1.field2 <op> 'literal'} becomes a {@link Clause};
 * comparisons joined by AND/OR become a left-to-right {@link PlanValue.ClauseChain}
 * where every clause after the head records the operator that joined it.
 * Stateless and safe to share.
 */
public class QueryPlanner {
    private static final int IDENTIFIER_SEGMENTS = 3;

    public PlanValue fold(Expression expression) throws TranslationException {
        if (expression instanceof Column column) {
            return foldColumn(column);
        }
        if (expression instanceof StringValue value) {
            return new PlanValue.StringScalar(value.getValue());
        }
        if (isNonStringLiteral(expression)) {
            throw new UnsupportedSyntaxException("non-string literal " + expression);
        }
        if (expression instanceof BinaryExpression binary) {
            Operator op = Operator.of(binary);
            PlanValue left = fold(binary.getLeftExpression());
            PlanValue right = fold(binary.getRightExpression());
            return combine(left, op, right);
        }
        throw new UnsupportedSyntaxException("expression " + expression.getClass().getSimpleName()
                + " (" + expression + ")");
    }

    private PlanValue foldColumn(Column column) {
        String name = column.getFullyQualifiedName();
        // A lone "double quoted" name is how the grammar hands back a double-quoted string
        if (isDoubleQuoted(name)) {
            return new PlanValue.StringScalar(name.substring(1, name.length() - 1));
        }
        ImmutableList<String> segments = Lists.immutable.ofAll(Arrays.asList(name.split("\\.")))
                .collect(QueryPlanner::stripQuotes);
        return new PlanValue.StringList(segments);
    }

    private PlanValue combine(PlanValue left, Operator op, PlanValue right) throws TranslationException {
        return switch (left.kind()) {
            case STRING_LIST -> {
                if (left instanceof PlanValue.StringList list && right instanceof PlanValue.StringScalar scalar) {
                    yield new PlanValue.ClauseValue(clause(list.segments(), op, scalar.value()));
                }
                throw new TypeMismatchException(left.kind(), right.kind());
            }
            case CLAUSE -> {
                if (left instanceof PlanValue.ClauseValue head && right instanceof PlanValue.ClauseValue next) {
                    yield PlanValue.ClauseChain.of(head.clause(), next.clause().withChainOp(op));
                }
                throw new TypeMismatchException(left.kind(), right.kind());
            }
            case CLAUSE_CHAIN -> {
                if (left instanceof PlanValue.ClauseChain chain && right instanceof PlanValue.ClauseValue next) {
                    yield chain.append(next.clause().withChainOp(op));
                }
                throw new TypeMismatchException(left.kind(), right.kind());
            }
            case STRING_SCALAR -> throw new TypeMismatchException(left.kind(), right.kind());
        };
    }

    private Clause clause(ImmutableList<String> segments, Operator comparator, String literal) throws ArityException {
        if (segments.size() != IDENTIFIER_SEGMENTS) {
            throw new ArityException(segments);
        }
        return new Clause(null, segments.get(0), segments.get(1), segments.get(2), comparator,
                HyphenEscaping.unescape(literal));
    }

    private static boolean isNonStringLiteral(Expression expression) {
        return expression instanceof LongValue
                || expression instanceof DoubleValue
                || expression instanceof NullValue
                || expression instanceof HexValue
                || expression instanceof DateValue
                || expression instanceof TimeValue
                || expression instanceof TimestampValue;
    }

    private static boolean isDoubleQuoted(String name) {
        return name.length() >= 2
                && name.charAt(0) == '"'
                && name.indexOf('"', 1) == name.length() - 1;
    }

    static String stripQuotes(String identifier) {
        if (identifier.length() >= 2) {
            char first = identifier.charAt(0);
            char last = identifier.charAt(identifier.length() - 1);
            if ((first == '"' && last == '"') || (first == '`' && last == '`')) {
                return identifier.substring(1, identifier.length() - 1);
            }
        }
        return identifier;
    }
}
