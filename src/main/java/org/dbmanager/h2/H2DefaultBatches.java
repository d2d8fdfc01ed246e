package org.dbmanager.h2;

import com.typesafe.config.Config;
import org.dbmanager.api.batches.Batch;
import org.dbmanager.api.batches.ExecutionType;
import org.dbmanager.api.batches.TransactionRequirement;

/**
 * Default version detection and cleanup batches for H2.
 * <p>
 * The version is kept in a settings table with a name and a value column; the row whose name is
 * the version key holds the version. Table, columns and key are configurable under
 * {@code versioning}: {@code table} (default "_DatabaseSettings"), {@code nameColumn} (default
 * "Name"), {@code valueColumn} (default "Value"), {@code key} (default "Database.Version").
 */
public class H2DefaultBatches {

    private final String table;
    private final String nameColumn;
    private final String valueColumn;
    private final String versionKey;

    public H2DefaultBatches(Config versioning) {
        this.table = versioning.hasPath("table") ? versioning.getString("table") : "_DatabaseSettings";
        this.nameColumn = versioning.hasPath("nameColumn") ? versioning.getString("nameColumn") : "Name";
        this.valueColumn = versioning.hasPath("valueColumn") ? versioning.getString("valueColumn") : "Value";
        this.versionKey = versioning.hasPath("key") ? versioning.getString("key") : "Database.Version";
    }

    /**
     * Three steps: 0 if the settings table does not exist (new database), -1 if the version row is
     * missing (damaged), then the version value.
     */
    public Batch versionDetection() {
        Batch batch = new Batch();
        batch.addScript(String.format(
                "SELECT COUNT(*) FROM INFORMATION_SCHEMA.TABLES WHERE TABLE_SCHEMA = CURRENT_SCHEMA AND TABLE_NAME = %s",
                literal(table)), TransactionRequirement.DONT_CARE, null, ExecutionType.SCALAR);
        batch.addScript(String.format(
                "SELECT CASE WHEN COUNT(*) = 1 THEN 1 ELSE -1 END FROM %s WHERE %s = %s",
                identifier(table), identifier(nameColumn), literal(versionKey)),
                TransactionRequirement.DONT_CARE, null, ExecutionType.SCALAR);
        batch.addScript(String.format(
                "SELECT CAST(%s AS INT) FROM %s WHERE %s = %s",
                identifier(valueColumn), identifier(table), identifier(nameColumn), literal(versionKey)),
                TransactionRequirement.DONT_CARE, null, ExecutionType.SCALAR);
        return batch;
    }

    /**
     * Creates the settings table with version 0 unless it exists. Meant as the first statement
     * of the upgrade batch from version 0.
     */
    public String settingsTableCreation() {
        return String.format(
                "CREATE TABLE IF NOT EXISTS %s (%s VARCHAR(255) PRIMARY KEY, %s VARCHAR(4000))",
                identifier(table), identifier(nameColumn), identifier(valueColumn));
    }

    /**
     * Statement setting the stored version to {@code version}.
     */
    public String versionUpdate(int version) {
        return String.format("MERGE INTO %s (%s, %s) KEY (%s) VALUES (%s, %s)",
                identifier(table), identifier(nameColumn), identifier(valueColumn), identifier(nameColumn),
                literal(versionKey), literal(Integer.toString(version)));
    }

    /**
     * {@code ANALYZE} and {@code CHECKPOINT}, outside of any transaction.
     */
    public Batch cleanup() {
        Batch batch = new Batch();
        batch.addScript("ANALYZE", TransactionRequirement.DISALLOWED);
        batch.addScript("CHECKPOINT", TransactionRequirement.DISALLOWED);
        return batch;
    }

    static String identifier(String name) {
        return '"' + name.replace("\"", "\"\"") + '"';
    }

    static String literal(String value) {
        return '\'' + value.replace("'", "''") + '\'';
    }
}
