package org.dbmanager.api.batches;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link Batch}: transaction rules, execution state accessors, splitting and copying.
 */
@Tag("unit")
class BatchTest {

    // ===== Tests for requiresTransaction / disallowsTransaction =====

    @Test
    void testRequiresTransaction_RequiredAndDontCare() {
        Batch batch = new Batch();
        batch.addScript("A", TransactionRequirement.REQUIRED);
        batch.addScript("B", TransactionRequirement.DONT_CARE);

        assertTrue(batch.requiresTransaction());
        assertFalse(batch.disallowsTransaction());
    }

    @Test
    void testRequiresTransaction_AllDontCare() {
        Batch batch = new Batch();
        batch.addScript("A");
        batch.addCallback((connection, transaction, command) -> null);

        assertFalse(batch.requiresTransaction());
        assertFalse(batch.disallowsTransaction());
    }

    @Test
    void testDisallowsTransaction_DisallowedAndDontCare() {
        Batch batch = new Batch();
        batch.addScript("A", TransactionRequirement.DONT_CARE);
        batch.addScript("B", TransactionRequirement.DISALLOWED);

        assertTrue(batch.disallowsTransaction());
        assertFalse(batch.requiresTransaction());
    }

    @Test
    void testConflict_RequiredBeforeDisallowed() {
        Batch batch = new Batch();
        batch.addScript("A", TransactionRequirement.REQUIRED);
        batch.addScript("B", TransactionRequirement.DISALLOWED);

        assertThrows(ConflictingRequirementException.class, batch::requiresTransaction);
        assertThrows(ConflictingRequirementException.class, batch::disallowsTransaction);
    }

    @Test
    void testConflict_DisallowedBeforeRequired() {
        Batch batch = new Batch();
        batch.addScript("B", TransactionRequirement.DISALLOWED);
        batch.addScript("X", TransactionRequirement.DONT_CARE);
        batch.addCallback((connection, transaction, command) -> null, TransactionRequirement.REQUIRED);

        assertThrows(ConflictingRequirementException.class, batch::requiresTransaction);
        assertThrows(ConflictingRequirementException.class, batch::disallowsTransaction);
    }

    @Test
    void testIsolationLevel_SameLevelsAgree() {
        Batch batch = new Batch();
        batch.addScript("A", TransactionRequirement.REQUIRED, IsolationLevel.SERIALIZABLE, null);
        batch.addScript("B");
        batch.addScript("C", TransactionRequirement.REQUIRED, IsolationLevel.SERIALIZABLE, null);

        assertEquals(IsolationLevel.SERIALIZABLE, batch.getIsolationLevel());
    }

    @Test
    void testIsolationLevel_DifferentLevelsConflict() {
        Batch batch = new Batch();
        batch.addScript("A", TransactionRequirement.REQUIRED, IsolationLevel.SERIALIZABLE, null);
        batch.addScript("B", TransactionRequirement.REQUIRED, IsolationLevel.READ_COMMITTED, null);

        assertThatThrownBy(batch::getIsolationLevel)
                .isInstanceOf(ConflictingRequirementException.class)
                .hasMessageContaining("SERIALIZABLE")
                .hasMessageContaining("READ_COMMITTED");
    }

    // ===== Tests for execution state =====

    @Test
    void testAccessors_NothingExecuted() {
        Batch batch = new Batch();
        batch.addScript("A");

        assertNull(batch.getResult());
        assertTrue(batch.getResults().isEmpty());
        assertNull(batch.getError());
        assertTrue(batch.getErrors().isEmpty());
        assertNull(batch.getException());
        assertTrue(batch.getExceptions().isEmpty());
        assertFalse(batch.wasFullyExecuted());
        assertFalse(batch.wasPartiallyExecuted());
        assertFalse(batch.hasFailed());
    }

    @Test
    void testAccessors_EmptyBatchIsFullyExecuted() {
        Batch batch = new Batch();

        assertTrue(batch.wasFullyExecuted());
        assertFalse(batch.wasPartiallyExecuted());
        assertFalse(batch.hasFailed());
    }

    @Test
    void testAccessors_PartiallyExecutedWithFailure() {
        Batch batch = new Batch();
        BatchCommand first = batch.addScript("A");
        BatchCommand second = batch.addScript("B");
        batch.addScript("C");

        first.setResult(1);
        first.setExecuted(true);
        second.setException(new IllegalStateException("boom"));
        second.setError("boom");

        assertEquals(1, batch.getResult());
        assertEquals(List.of(1), batch.getResults());
        assertEquals("boom", batch.getError());
        assertThat(batch.getException()).isInstanceOf(IllegalStateException.class);
        assertTrue(batch.wasPartiallyExecuted());
        assertFalse(batch.wasFullyExecuted());
        assertTrue(batch.hasFailed());
    }

    @Test
    void testReset_IsIdempotent() {
        Batch batch = new Batch();
        BatchCommand command = batch.addScript("A");
        command.setResult("value");
        command.setError("soft error");
        command.setException(new RuntimeException("x"));
        command.setExecuted(true);

        batch.reset();
        assertResetState(command);
        batch.reset();
        assertResetState(command);
        assertEquals("A", command.getScript());
    }

    private static void assertResetState(BatchCommand command) {
        assertNull(command.getResult());
        assertNull(command.getError());
        assertNull(command.getException());
        assertFalse(command.wasExecuted());
    }

    @Test
    void testThrowIfFailed_FirstFailureWithCause() {
        Batch batch = new Batch();
        batch.addScript("A");
        BatchCommand failed = batch.addScript("B");
        failed.setException(new IllegalStateException("first"));
        failed.setError("first");

        assertThatThrownBy(batch::throwIfFailed)
                .isInstanceOf(BatchExecutionException.class)
                .hasMessage("Database batch execution failed: first")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void testThrowIfAnyFailed_AggregatesFailures() {
        Batch batch = new Batch();
        batch.addScript("A").setError("soft one");
        batch.addScript("B");
        batch.addScript("C").setError("soft two");

        BatchExecutionException thrown = assertThrows(BatchExecutionException.class, batch::throwIfAnyFailed);
        assertThat(thrown.getMessage()).contains("soft one");
        assertThat(thrown.getSuppressed()).hasSize(1);
        assertThat(thrown.getSuppressed()[0].getMessage()).contains("soft two");
    }

    @Test
    void testThrowIfFailed_NoFailureDoesNothing() {
        Batch batch = new Batch();
        batch.addScript("A").setExecuted(true);

        assertDoesNotThrow(batch::throwIfFailed);
        assertDoesNotThrow(batch::throwIfAnyFailed);
    }

    // ===== Tests for splitCommands / copy =====

    @Test
    void testSplitCommands_PreservesIdentity() {
        Batch batch = new Batch();
        BatchCommand a = batch.addScript("A");
        BatchCommand b = batch.addScript("B", TransactionRequirement.REQUIRED);

        List<Batch> split = batch.splitCommands();

        assertEquals(2, split.size());
        assertSame(a, split.get(0).getCommands().get(0));
        assertSame(b, split.get(1).getCommands().get(0));
    }

    @Test
    void testSplitCommands_WithFilter() {
        Batch batch = new Batch();
        batch.addScript("A");
        BatchCommand required = batch.addScript("B", TransactionRequirement.REQUIRED);

        List<Batch> split = batch.splitCommands(command -> command.getTransactionRequirement() == TransactionRequirement.REQUIRED);

        assertEquals(1, split.size());
        assertSame(required, split.get(0).getCommands().get(0));
    }

    @Test
    void testCopy_IsDeep() {
        Batch batch = new Batch();
        BatchCommand original = batch.addScript("SELECT :id", TransactionRequirement.REQUIRED, IsolationLevel.SERIALIZABLE, ExecutionType.SCALAR);
        original.withParameter("id", 1);

        Batch copy = batch.copy();
        BatchCommand copied = copy.getCommands().get(0);
        copied.getParameters().add("id", 2);
        copied.setScript("SELECT 2");

        assertNotSame(original, copied);
        assertEquals(1, original.getParameters().get("id").orElseThrow().value());
        assertEquals("SELECT :id", original.getScript());
        assertEquals(ExecutionType.SCALAR, copied.getExecutionType());
        assertEquals(IsolationLevel.SERIALIZABLE, copied.getIsolationLevel().orElseThrow());
    }

    @Test
    void testCommandValidity() {
        BatchCommand script = new BatchCommand("A", null, null, null);
        BatchCommand neither = new BatchCommand((String) null, null, null, null);
        BatchCommand both = new BatchCommand("A", null, null, null);
        both.setCallback((connection, transaction, command) -> null);

        assertTrue(script.isValid());
        assertFalse(neither.isValid());
        assertFalse(both.isValid());
        assertEquals(TransactionRequirement.DONT_CARE, script.getTransactionRequirement());
        assertEquals(ExecutionType.NON_QUERY, script.getExecutionType());
    }
}
