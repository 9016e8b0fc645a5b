package com.challenges.kubesql.execution;

import com.challenges.kubesql.query.Clause;
import com.challenges.kubesql.query.Operator;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FieldSelectorsTest {

    private static Clause clause(Operator chainOp, String field1, String field2, Operator comparator, String literal) {
        return new Clause(chainOp, "pod", field1, field2, comparator, literal);
    }

    @Test
    public void testSingleEquality() throws PlanExecutionException {
        assertEquals(Lists.immutable.of("status.phase=Running"),
                FieldSelectors.render(Lists.immutable.of(clause(null, "status", "phase", Operator.EQUALS, "Running"))));
    }

    @Test
    public void testAndJoinsWithComma() throws PlanExecutionException {
        assertEquals(Lists.immutable.of("status.phase!=Pending,metadata.name=web"),
                FieldSelectors.render(Lists.immutable.of(
                        clause(null, "status", "phase", Operator.NOT_EQUALS, "Pending"),
                        clause(Operator.AND, "metadata", "name", Operator.EQUALS, "web"))));
    }

    @Test
    public void testOrStartsNewSelector() throws PlanExecutionException {
        assertEquals(Lists.immutable.of("status.phase=Running,metadata.name=a", "metadata.name=b"),
                FieldSelectors.render(Lists.immutable.of(
                        clause(null, "status", "phase", Operator.EQUALS, "Running"),
                        clause(Operator.AND, "metadata", "name", Operator.EQUALS, "a"),
                        clause(Operator.OR, "metadata", "name", Operator.EQUALS, "b"))));
    }

    @Test
    public void testOrOnFirstClauseOfKindDoesNotEmitEmptySelector() throws PlanExecutionException {
        // the OR joined this clause to a clause of another kind
        assertEquals(Lists.immutable.of("metadata.name=b"),
                FieldSelectors.render(Lists.immutable.of(clause(Operator.OR, "metadata", "name", Operator.EQUALS, "b"))));
    }

    @Test
    public void testOrderingComparatorsAreRejected() {
        PlanExecutionException e = assertThrows(PlanExecutionException.class, () -> FieldSelectors.render(
                Lists.immutable.of(clause(null, "status", "phase", Operator.GREATER_THAN, "a"))));

        assertTrue(e.getMessage().contains("'>'"), e.getMessage());
    }

    @Test
    public void testNoClausesNoSelectors() throws PlanExecutionException {
        assertTrue(FieldSelectors.render(Lists.immutable.empty()).isEmpty());
    }
}
