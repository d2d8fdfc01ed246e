package org.dbmanager.h2;

import com.typesafe.config.ConfigFactory;
import org.dbmanager.api.batches.Batch;
import org.dbmanager.api.batches.ExecutionType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class H2DefaultBatchesTest {

    @Test
    void testVersionDetection_HasThreeScalarSteps() {
        Batch batch = new H2DefaultBatches(ConfigFactory.empty()).versionDetection();

        assertEquals(3, batch.size());
        assertTrue(batch.getCommands().stream().allMatch(command -> command.getExecutionType() == ExecutionType.SCALAR));
        assertThat(batch.getCommands().get(0).getScript()).contains("TABLE_NAME = '_DatabaseSettings'");
        assertThat(batch.getCommands().get(2).getScript()).contains("WHERE \"Name\" = 'Database.Version'");
    }

    @Test
    void testConfiguredLayoutIsQuoted() {
        H2DefaultBatches batches = new H2DefaultBatches(ConfigFactory.parseString("""
                table = "app_settings"
                nameColumn = "setting"
                valueColumn = "content"
                key = "schema's version"
                """));

        assertEquals("MERGE INTO \"app_settings\" (\"setting\", \"content\") KEY (\"setting\") VALUES ('schema''s version', '4')",
                batches.versionUpdate(4));
        assertEquals("CREATE TABLE IF NOT EXISTS \"app_settings\" (\"setting\" VARCHAR(255) PRIMARY KEY, \"content\" VARCHAR(4000))",
                batches.settingsTableCreation());
    }

    @Test
    void testCleanup_RunsOutsideTransactions() {
        Batch batch = new H2DefaultBatches(ConfigFactory.empty()).cleanup();

        assertTrue(batch.disallowsTransaction());
        assertEquals(2, batch.size());
    }

    @Test
    void testBackupCreator_RejectsUnknownCompression() {
        assertThrows(IllegalArgumentException.class,
                () -> new H2BackupCreator(ConfigFactory.parseString("compression = rar")));
    }
}
