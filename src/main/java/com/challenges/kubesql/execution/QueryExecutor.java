package com.challenges.kubesql.execution;

import com.challenges.kubesql.query.QueryPlan;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.factory.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Runs a {@link QueryPlan}: one list request per context, namespace, resource kind and field selector.
 */
public class QueryExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(QueryExecutor.class);

    private final ResourceLister lister;

    public QueryExecutor(ResourceLister lister) {
        this.lister = lister;
    }

    public QueryResult execute(QueryPlan plan) throws PlanExecutionException {
        // Render every selector up front so an unsupported clause fails before any request is made
        MutableMap<ResourceKind, ImmutableList<String>> selectors = Maps.mutable.empty();
        for (String name : plan.resourceKinds()) {
            selectors.put(ResourceKind.of(name), FieldSelectors.render(plan.clausesFor(name)));
        }
        ImmutableList<ResourceKind> kinds = Lists.immutable.ofAll(Arrays.asList(ResourceKind.values()))
                .select(selectors::containsKey);

        MutableList<QueryResult.ResourceRow> rows = Lists.mutable.empty();
        for (String context : plan.contexts()) {
            for (String namespace : plan.namespaces()) {
                for (ResourceKind kind : kinds) {
                    rows.add(new QueryResult.ResourceRow(context, namespace, kind,
                            list(context, namespace, kind, selectors.get(kind))));
                }
            }
        }
        return new QueryResult(plan.contexts(), plan.namespaces(), kinds, rows.toImmutable());
    }

    private ImmutableList<String> list(String context, String namespace, ResourceKind kind,
                                       ImmutableList<String> fieldSelectors) throws PlanExecutionException {
        MutableList<String> names = Lists.mutable.empty();
        MutableSet<String> seen = Sets.mutable.empty();
        for (String fieldSelector : fieldSelectors) {
            LOG.debug("Listing {} in {}/{} with --field-selector {}", kind.plural(), context, namespace, fieldSelector);
            for (String name : lister.list(context, namespace, kind, fieldSelector)) {
                if (seen.add(name)) {
                    names.add(name);
                }
            }
        }
        return names.toImmutable();
    }
}
