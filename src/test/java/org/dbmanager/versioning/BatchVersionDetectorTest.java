package org.dbmanager.versioning;

import org.dbmanager.api.batches.Batch;
import org.dbmanager.api.batches.BatchCommand;
import org.dbmanager.api.batches.ExecutionType;
import org.dbmanager.api.manager.IDbManager;
import org.dbmanager.api.versioning.VersionDetection;
import org.dbmanager.junit.extensions.logging.ExpectLog;
import org.dbmanager.junit.extensions.logging.LogLevel;
import org.dbmanager.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * The mocked manager answers each script with the value registered in {@link #results}; a script
 * without a value fails.
 */
@Tag("unit")
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
@MockitoSettings(strictness = Strictness.LENIENT)
class BatchVersionDetectorTest {

    @Mock
    private IDbManager manager;

    private final Map<String, Object> results = new HashMap<>();
    private final List<String> executed = new ArrayList<>();

    @BeforeEach
    void setUp() {
        when(manager.getName()).thenReturn("test-db");
        when(manager.executeBatch(any(), anyBoolean(), anyBoolean())).thenAnswer(inv -> {
            Batch batch = inv.getArgument(0);
            BatchCommand command = batch.getCommands().get(0);
            executed.add(command.getScript());
            if (!results.containsKey(command.getScript())) {
                command.setError("table not found");
                return false;
            }
            command.setResult(results.get(command.getScript()));
            command.setExecuted(true);
            return true;
        });
    }

    private static Batch detectionBatch(String... scripts) {
        Batch batch = new Batch();
        for (String script : scripts) {
            batch.addScript(script);
        }
        return batch;
    }

    // ===== Tests for detect =====

    @Test
    void testDetect_StopsAtZeroForNewDatabase() {
        results.put("tableExists", 0L);
        BatchVersionDetector detector = new BatchVersionDetector(null,
                () -> detectionBatch("tableExists", "keyExists", "readVersion"));

        VersionDetection detection = detector.detect(manager);

        assertEquals(VersionDetection.of(0), detection);
        assertEquals(List.of("tableExists"), executed);
    }

    @Test
    void testDetect_LastValueIsTheVersion() {
        results.put("tableExists", 1L);
        results.put("keyExists", 1);
        results.put("readVersion", "7");
        BatchVersionDetector detector = new BatchVersionDetector(null,
                () -> detectionBatch("tableExists", "keyExists", "readVersion"));

        assertEquals(VersionDetection.of(7), detector.detect(manager));
        assertEquals(3, executed.size());
    }

    @Test
    void testDetect_NegativeValueStopsAsDamaged() {
        results.put("tableExists", 1);
        results.put("keyExists", -1);
        BatchVersionDetector detector = new BatchVersionDetector(null,
                () -> detectionBatch("tableExists", "keyExists", "readVersion"));

        assertEquals(VersionDetection.of(-1), detector.detect(manager));
    }

    @Test
    void testDetect_ForcesScalarExecutionOneCommandAtATime() {
        results.put("a", 1);
        results.put("b", 2);
        Batch batch = detectionBatch("a", "b");
        BatchVersionDetector detector = new BatchVersionDetector(null, () -> batch);

        detector.detect(manager);

        assertTrue(batch.getCommands().stream().allMatch(command -> command.getExecutionType() == ExecutionType.SCALAR));
        verify(manager, times(2)).executeBatch(any(), eq(false), eq(false));
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Version detection of database 'test-db' failed: table not found")
    void testDetect_FailingCommandFailsDetection() {
        results.put("tableExists", 1);
        BatchVersionDetector detector = new BatchVersionDetector(null, () -> detectionBatch("tableExists", "broken"));

        assertEquals(VersionDetection.failed(), detector.detect(manager));
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Version detection of database 'test-db' returned a non-numeric value: v1")
    void testDetect_NonNumericValueFailsDetection() {
        results.put("version", "v1");
        BatchVersionDetector detector = new BatchVersionDetector(null, () -> detectionBatch("version"));

        assertFalse(detector.detect(manager).success());
    }

    @Test
    void testDetect_UsesNamedBatchWhenConfigured() {
        results.put("SELECT 4", 4);
        when(manager.getBatch("detect-version")).thenReturn(Optional.of(detectionBatch("SELECT 4")));
        BatchVersionDetector detector = new BatchVersionDetector("detect-version", () -> detectionBatch("unused"));

        assertEquals(VersionDetection.of(4), detector.detect(manager));
        assertEquals(List.of("SELECT 4"), executed);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "No version detection batch available for database 'test-db'")
    void testDetect_MissingNamedBatchFails() {
        when(manager.getBatch("detect-version")).thenReturn(Optional.empty());
        BatchVersionDetector detector = new BatchVersionDetector("detect-version", null);

        assertEquals(VersionDetection.failed(), detector.detect(manager));
    }

    // ===== Tests for toVersion =====

    @Test
    void testToVersion_InterpretsScalarResults() {
        assertEquals(Optional.of(-1), BatchVersionDetector.toVersion(null));
        assertEquals(Optional.of(3), BatchVersionDetector.toVersion(3L));
        assertEquals(Optional.of(1), BatchVersionDetector.toVersion(true));
        assertEquals(Optional.of(0), BatchVersionDetector.toVersion(false));
        assertEquals(Optional.of(12), BatchVersionDetector.toVersion(" 12 "));
        assertEquals(Optional.of(5), BatchVersionDetector.toVersion(List.of(1, 5)));
        assertEquals(Optional.of(-1), BatchVersionDetector.toVersion(List.of()));
        assertEquals(Optional.empty(), BatchVersionDetector.toVersion(Long.MAX_VALUE));
        assertEquals(Optional.empty(), BatchVersionDetector.toVersion("abc"));
    }
}
