package org.dbmanager.api.batches;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class TransactionRequirementTest {

    @Test
    void testMerge_DontCareYields() {
        assertEquals(TransactionRequirement.REQUIRED, TransactionRequirement.DONT_CARE.merge(TransactionRequirement.REQUIRED));
        assertEquals(TransactionRequirement.DISALLOWED, TransactionRequirement.DISALLOWED.merge(TransactionRequirement.DONT_CARE));
        assertEquals(TransactionRequirement.DONT_CARE, TransactionRequirement.DONT_CARE.merge(null));
    }

    @Test
    void testMerge_OppositeRequirementsConflict() {
        assertThrows(ConflictingRequirementException.class,
                () -> TransactionRequirement.REQUIRED.merge(TransactionRequirement.DISALLOWED));
        assertThrows(ConflictingRequirementException.class,
                () -> TransactionRequirement.DISALLOWED.merge(TransactionRequirement.REQUIRED));
    }
}
