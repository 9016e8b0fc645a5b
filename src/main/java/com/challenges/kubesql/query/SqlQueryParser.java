package com.challenges.kubesql.query;

import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectItem;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Translates {@code SELECT <namespaces> FROM <contexts> WHERE <clauses>} into a {@link QueryPlan}.
 */
public class SqlQueryParser {
    private static final Logger LOG = LoggerFactory.getLogger(SqlQueryParser.class);

    private final QueryPlanner planner;

    public SqlQueryParser() {
        this(new QueryPlanner());
    }

    public SqlQueryParser(QueryPlanner planner) {
        this.planner = planner;
    }

    public QueryPlan parse(String sql) throws TranslationException {
        if (sql == null || sql.isBlank()) {
            throw new MalformedQueryException("Empty query", null);
        }
        String escaped = HyphenEscaping.escape(sql.trim());
        LOG.debug("Parsing escaped query: {}", escaped);

        Statement statement;
        try {
            statement = CCJSqlParserUtil.parse(escaped);
        } catch (JSQLParserException e) {
            throw new MalformedQueryException("Invalid SQL: " + rootMessage(e), e);
        }
        QueryPlan plan = extract(statement);
        LOG.debug("Translated query plan: {}", plan);
        return plan;
    }

    public QueryPlan extract(Statement statement) throws TranslationException {
        if (!(statement instanceof Select)) {
            throw new UnsupportedSyntaxException("Only SELECT statements are supported, got "
                    + statement.getClass().getSimpleName());
        }
        if (!(statement instanceof PlainSelect select)) {
            throw new UnsupportedSyntaxException("set operation " + statement.getClass().getSimpleName());
        }
        GrammarGuard.checkSelect(select);

        ImmutableList<String> namespaces = namespaces(select.getSelectItems());
        ImmutableList<String> contexts = contexts(select.getFromItem(), select.getJoins());
        ImmutableList<Clause> clauses = clauses(select.getWhere());

        return new QueryPlan(namespaces, contexts, clauses);
    }

    private ImmutableList<String> namespaces(List<SelectItem<?>> items) throws UnsupportedSyntaxException,
            MissingClauseException {
        if (items == null || items.isEmpty()) {
            throw new MissingClauseException(MissingClauseException.ClauseKind.PROJECTION);
        }
        MutableList<String> namespaces = Lists.mutable.empty();
        for (SelectItem<?> item : items) {
            namespaces.add(HyphenEscaping.unescape(GrammarGuard.checkProjection(item)));
        }
        return namespaces.toImmutable();
    }

    private ImmutableList<String> contexts(FromItem from, List<Join> joins) throws UnsupportedSyntaxException,
            MissingClauseException {
        if (from == null) {
            throw new MissingClauseException(MissingClauseException.ClauseKind.FROM);
        }
        MutableList<String> contexts = Lists.mutable.empty();
        contexts.add(HyphenEscaping.unescape(GrammarGuard.checkTable(from)));
        if (joins != null) {
            for (Join join : joins) {
                GrammarGuard.checkJoin(join);
                contexts.add(HyphenEscaping.unescape(GrammarGuard.checkTable(join.getRightItem())));
            }
        }
        return contexts.toImmutable();
    }

    private ImmutableList<Clause> clauses(Expression where) throws TranslationException {
        if (where == null) {
            throw new MissingClauseException(MissingClauseException.ClauseKind.WHERE);
        }
        PlanValue value = planner.fold(where);
        if (value instanceof PlanValue.ClauseValue single) {
            return Lists.immutable.of(single.clause());
        }
        if (value instanceof PlanValue.ClauseChain chain) {
            return chain.clauses();
        }
        throw new UnsupportedSyntaxException("Unable to handle unsupported query plan: " + value);
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        String message = cause.getMessage();
        return message != null ? message.lines().findFirst().orElse(message) : cause.getClass().getSimpleName();
    }
}
