package org.dbmanager.utils;

import org.dbmanager.api.batches.ExecutionType;
import org.dbmanager.api.batches.TransactionRequirement;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class EnumNamesTest {

    @ParameterizedTest
    @ValueSource(strings = {"DONT_CARE", "DontCare", "dontcare", " dont_care ", "Dont_Care"})
    void testParse_IgnoresCaseAndUnderscores(String name) {
        assertEquals(Optional.of(TransactionRequirement.DONT_CARE), EnumNames.parse(TransactionRequirement.class, name));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "Query", "NON-QUERY"})
    void testParse_UnknownOrBlankIsEmpty(String name) {
        assertEquals(Optional.empty(), EnumNames.parse(ExecutionType.class, name));
    }

    @Test
    void testParse_NullIsEmpty() {
        assertEquals(Optional.empty(), EnumNames.parse(ExecutionType.class, null));
    }
}
