package com.challenges.kubesql.output;

import com.challenges.kubesql.execution.QueryResult;
import com.challenges.kubesql.execution.ResourceKind;
import de.vandermeer.asciitable.AsciiTable;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Arrays;

/**
 * Lays out a {@link QueryResult} with one row per resource kind and one column per context.
 * Each cell holds one line per namespace: {@code namespace: name1, name2} or {@code namespace: -}.
 */
public class TableFormatter {
    static final String HEADER = "KIND / CONTEXT";
    static final String EMPTY_CELL = "-";

    private static final String LINE_BREAK = "<br>";
    // border plus one space of padding on each side, plus one spare column so nothing wraps
    private static final int COLUMN_OVERHEAD = 4;

    public String format(QueryResult result) {
        MutableList<MutableList<String>> rows = Lists.mutable.empty();
        rows.add(Lists.mutable.of(HEADER).withAll(result.contexts()));
        for (ResourceKind kind : result.kinds()) {
            MutableList<String> row = Lists.mutable.of(kind.singular());
            for (String context : result.contexts()) {
                row.add(formatCell(result, context, kind));
            }
            rows.add(row);
        }

        AsciiTable table = new AsciiTable();
        table.addRule();
        for (MutableList<String> row : rows) {
            table.addRow(row);
            table.addRule();
        }
        return table.render(width(rows));
    }

    private String formatCell(QueryResult result, String context, ResourceKind kind) {
        MutableList<String> lines = Lists.mutable.empty();
        for (String namespace : result.namespaces()) {
            ImmutableList<String> found = result.names(context, namespace, kind);
            lines.add(namespace + ": " + (found.isEmpty() ? EMPTY_CELL : found.makeString(", ")));
        }
        return lines.makeString(LINE_BREAK);
    }

    /**
     * Columns share the width evenly, so every column gets room for the longest line of any cell.
     */
    private static int width(MutableList<MutableList<String>> rows) {
        int longest = rows.flatCollect(row -> row)
                .flatCollect(cell -> Arrays.asList(cell.split(LINE_BREAK)))
                .collectInt(String::length)
                .max();
        int columns = rows.getFirst().size();
        return columns * (longest + COLUMN_OVERHEAD) + 1;
    }
}
