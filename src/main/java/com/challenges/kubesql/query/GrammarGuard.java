package com.challenges.kubesql.query;

import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.select.AllColumns;
import net.sf.jsqlparser.statement.select.AllTableColumns;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.ParenthesedFromItem;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.statement.select.TableFunction;

/**
 * Rejects every piece of SQL surface syntax that has no meaning for a
 * namespace/context/field-selector query. Each shape gets its own message.
 */
final class GrammarGuard {
    private GrammarGuard() {
    }

    /**
     * Clauses the grammar accepts on a plain SELECT but that would be silently ignored.
     */
    static void checkSelect(PlainSelect select) throws UnsupportedSyntaxException {
        if (select.getWithItemsList() != null && !select.getWithItemsList().isEmpty()) {
            throw new UnsupportedSyntaxException("WITH clause");
        }
        if (select.getDistinct() != null) {
            throw new UnsupportedSyntaxException("DISTINCT");
        }
        if (select.getGroupBy() != null) {
            throw new UnsupportedSyntaxException("GROUP BY");
        }
        if (select.getHaving() != null) {
            throw new UnsupportedSyntaxException("HAVING");
        }
        if (select.getOrderByElements() != null && !select.getOrderByElements().isEmpty()) {
            throw new UnsupportedSyntaxException("ORDER BY");
        }
        if (select.getLimit() != null) {
            throw new UnsupportedSyntaxException("LIMIT");
        }
    }

    /**
     * @return the projected identifier, unquoted but still escaped
     */
    static String checkProjection(SelectItem<?> item) throws UnsupportedSyntaxException {
        Expression expression = item.getExpression();
        if (expression instanceof AllTableColumns) {
            throw new UnsupportedSyntaxException("qualified wildcard projection");
        }
        if (expression instanceof AllColumns) {
            throw new UnsupportedSyntaxException("wildcard projection");
        }
        if (item.getAlias() != null) {
            throw new UnsupportedSyntaxException("projection alias");
        }
        if (!(expression instanceof Column column)) {
            throw new UnsupportedSyntaxException("non-identifier projection " + expression);
        }
        if (column.getTable() != null && column.getTable().getName() != null) {
            throw new UnsupportedSyntaxException("qualified namespace " + column.getFullyQualifiedName());
        }
        return QueryPlanner.stripQuotes(column.getColumnName());
    }

    static void checkJoin(Join join) throws UnsupportedSyntaxException {
        // "FROM a, b" comes back as a simple join without any condition
        boolean hasCondition = (join.getOnExpressions() != null && !join.getOnExpressions().isEmpty())
                || (join.getUsingColumns() != null && !join.getUsingColumns().isEmpty());
        if (!join.isSimple() || hasCondition) {
            throw new UnsupportedSyntaxException("join");
        }
    }

    /**
     * @return the table name, unquoted but still escaped
     */
    static String checkTable(FromItem item) throws UnsupportedSyntaxException {
        if (item instanceof TableFunction) {
            throw new UnsupportedSyntaxException("table function arguments");
        }
        if (item instanceof ParenthesedSelect) {
            throw new UnsupportedSyntaxException("derived table");
        }
        if (item instanceof ParenthesedFromItem) {
            throw new UnsupportedSyntaxException("nested join");
        }
        if (!(item instanceof Table table)) {
            throw new UnsupportedSyntaxException("FROM item " + item.getClass().getSimpleName());
        }
        if (table.getAlias() != null) {
            throw new UnsupportedSyntaxException("table alias");
        }
        if (table.getIndexHint() != null || table.getSqlServerHints() != null) {
            throw new UnsupportedSyntaxException("table hint");
        }
        return QueryPlanner.stripQuotes(table.getFullyQualifiedName());
    }
}
