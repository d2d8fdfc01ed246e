package org.dbmanager.api.versioning;

import org.dbmanager.api.manager.DbState;

/**
 * Raw outcome of a version detection.
 *
 * @param success whether detection could be performed at all
 * @param state   a state the detector determined itself, or {@code null} to let the manager derive it
 * @param version the detected version; 0 for a database not yet created, negative if damaged
 */
public record VersionDetection(boolean success, DbState state, int version) {

    public static VersionDetection of(int version) {
        return new VersionDetection(true, null, version);
    }

    public static VersionDetection failed() {
        return new VersionDetection(false, null, -1);
    }
}
