package com.challenges.kubesql.output;

import com.challenges.kubesql.query.Clause;
import com.challenges.kubesql.query.QueryPlan;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;

/**
 * Writes a {@link QueryPlan} as JSON, used by {@code --explain}.
 */
public class PlanFormatter {
    private final JsonFactory factory = new JsonFactory();
    private final boolean prettyPrint;

    public PlanFormatter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    public String format(QueryPlan plan) {
        StringWriter writer = new StringWriter();
        try (JsonGenerator generator = factory.createGenerator(writer)) {
            if (prettyPrint) {
                generator.useDefaultPrettyPrinter();
            }
            generator.writeStartObject();
            writeStrings(generator, "namespaces", plan.namespaces());
            writeStrings(generator, "contexts", plan.contexts());
            generator.writeArrayFieldStart("clauses");
            for (Clause clause : plan.clauses()) {
                writeClause(generator, clause);
            }
            generator.writeEndArray();
            generator.writeEndObject();
        } catch (IOException e) {
            // StringWriter does not fail
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }

    private void writeStrings(JsonGenerator generator, String field, Iterable<String> values) throws IOException {
        generator.writeArrayFieldStart(field);
        for (String value : values) {
            generator.writeString(value);
        }
        generator.writeEndArray();
    }

    private void writeClause(JsonGenerator generator, Clause clause) throws IOException {
        generator.writeStartObject();
        if (clause.isChainHead()) {
            generator.writeNullField("chainOp");
        } else {
            generator.writeStringField("chainOp", clause.chainOp().symbol());
        }
        generator.writeStringField("resourceKind", clause.resourceKind());
        generator.writeStringField("fieldPath1", clause.fieldPath1());
        generator.writeStringField("fieldPath2", clause.fieldPath2());
        generator.writeStringField("comparator", clause.comparator().symbol());
        generator.writeStringField("literal", clause.literal());
        generator.writeEndObject();
    }
}
