package org.dbmanager.versioning;

import org.dbmanager.api.batches.Batch;
import org.dbmanager.api.manager.IDbManager;
import org.dbmanager.api.versioning.IVersionUpgrader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Upgrades with one batch per version step, found by batch name.
 * <p>
 * Every batch whose name matches the name format is an upgrade step; the format's
 * {@code sourceVersion} group is the version the step upgrades from. With the default format
 * {@value #DEFAULT_NAME_FORMAT}, a batch named {@code upgrade_0003} upgrades from version 3 to 4.
 * <p>
 * The lowest source version is the minimum version; the highest source version plus one is the
 * maximum version. Steps must be contiguous and unique.
 */
public class BatchNameVersionUpgrader implements IVersionUpgrader {

    private static final Logger log = LoggerFactory.getLogger(BatchNameVersionUpgrader.class);

    public static final String DEFAULT_NAME_FORMAT = ".+?(?<sourceVersion>\\d{4}).*";

    private final Pattern nameFormat;

    public BatchNameVersionUpgrader() {
        this(DEFAULT_NAME_FORMAT);
    }

    public BatchNameVersionUpgrader(String nameFormat) {
        if (nameFormat == null || !nameFormat.contains("(?<sourceVersion>")) {
            throw new IllegalArgumentException(
                    "Upgrade name format must define the named group 'sourceVersion': " + nameFormat);
        }
        this.nameFormat = Pattern.compile(nameFormat, Pattern.CASE_INSENSITIVE);
    }

    @Override
    public int getMinVersion(IDbManager manager) {
        TreeMap<Integer, String> steps = getUpgradeSteps(manager);
        return steps.isEmpty() ? -1 : steps.firstKey();
    }

    @Override
    public int getMaxVersion(IDbManager manager) {
        TreeMap<Integer, String> steps = getUpgradeSteps(manager);
        return steps.isEmpty() ? -1 : steps.lastKey() + 1;
    }

    @Override
    public boolean upgrade(IDbManager manager, int sourceVersion) {
        String batchName = getUpgradeSteps(manager).get(sourceVersion);
        if (batchName == null) {
            log.warn("No upgrade batch for source version {} of database '{}'", sourceVersion, manager.getName());
            return false;
        }
        Optional<Batch> batch = manager.getBatch(batchName);
        if (batch.isEmpty()) {
            log.warn("Upgrade batch '{}' of database '{}' could not be loaded", batchName, manager.getName());
            return false;
        }

        log.debug("Upgrading database '{}' from version {} with batch '{}'", manager.getName(), sourceVersion, batchName);
        try {
            return manager.executeBatch(batch.get(), false, true);
        } catch (RuntimeException e) {
            log.warn("Upgrade batch '{}' of database '{}' failed: {}", batchName, manager.getName(), e.getMessage());
            log.debug("Upgrade failure details for '{}':", batchName, e);
            return false;
        }
    }

    /**
     * @return batch names keyed by source version
     * @throws IllegalStateException if two batches share a source version or a version step is missing
     */
    TreeMap<Integer, String> getUpgradeSteps(IDbManager manager) {
        TreeMap<Integer, String> steps = new TreeMap<>();
        for (String name : manager.getBatchNames()) {
            Matcher matcher = nameFormat.matcher(name);
            if (!matcher.matches()) {
                continue;
            }
            int sourceVersion = Integer.parseInt(matcher.group("sourceVersion"));
            String previous = steps.put(sourceVersion, name);
            if (previous != null) {
                throw new IllegalStateException(String.format(
                        "Multiple upgrade batches for source version %d: '%s' and '%s'", sourceVersion, previous, name));
            }
        }

        int expected = steps.isEmpty() ? 0 : steps.firstKey();
        for (Map.Entry<Integer, String> step : steps.entrySet()) {
            if (step.getKey() != expected) {
                throw new IllegalStateException(String.format(
                        "Missing upgrade batch for source version %d (next found: '%s')", expected, step.getValue()));
            }
            expected++;
        }
        return steps;
    }
}
