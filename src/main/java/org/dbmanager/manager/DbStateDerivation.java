package org.dbmanager.manager;

import org.dbmanager.api.manager.DbState;
import org.dbmanager.api.versioning.VersionDetection;

/**
 * Derives the lifecycle state of a database from a raw version detection.
 * <p>
 * <strong>Rules, in order:</strong>
 * <ol>
 *   <li>failed detection, negative version or a detected {@link DbState#DAMAGED_OR_INVALID}:
 *       {@code (DAMAGED_OR_INVALID, -1)}</li>
 *   <li>a state reported by the detector is taken as is, together with the version</li>
 *   <li>with upgrade support: 0 is {@code NEW}, below min {@code TOO_OLD}, [min, max) {@code READY_OLD},
 *       max {@code READY_NEW}, above max {@code TOO_NEW}</li>
 *   <li>without upgrade support: 0 is {@code UNAVAILABLE}, anything else {@code READY_UNKNOWN}</li>
 * </ol>
 * The function is pure and total.
 */
public final class DbStateDerivation {

    private DbStateDerivation() {
        // Utility class - prevent instantiation
    }

    /**
     * A derived state together with the version it applies to.
     */
    public record StateAndVersion(DbState state, int version) {
    }

    public static StateAndVersion derive(VersionDetection detection, int minVersion, int maxVersion,
                                         boolean supportsUpgrade) {
        if (detection == null) {
            return new StateAndVersion(DbState.DAMAGED_OR_INVALID, -1);
        }
        return derive(detection.success(), detection.state(), detection.version(), minVersion, maxVersion, supportsUpgrade);
    }

    public static StateAndVersion derive(boolean success, DbState rawState, int rawVersion,
                                         int minVersion, int maxVersion, boolean supportsUpgrade) {
        if (!success || rawVersion < 0 || rawState == DbState.DAMAGED_OR_INVALID) {
            return new StateAndVersion(DbState.DAMAGED_OR_INVALID, -1);
        }
        if (rawState != null) {
            return new StateAndVersion(rawState, rawVersion);
        }
        if (!supportsUpgrade) {
            return new StateAndVersion(rawVersion == 0 ? DbState.UNAVAILABLE : DbState.READY_UNKNOWN, rawVersion);
        }

        DbState state;
        if (rawVersion == 0) {
            state = DbState.NEW;
        } else if (rawVersion < minVersion) {
            state = DbState.TOO_OLD;
        } else if (rawVersion < maxVersion) {
            state = DbState.READY_OLD;
        } else if (rawVersion == maxVersion) {
            state = DbState.READY_NEW;
        } else if (rawVersion > maxVersion) {
            state = DbState.TOO_NEW;
        } else {
            state = DbState.READY_UNKNOWN;
        }
        return new StateAndVersion(state, rawVersion);
    }
}
