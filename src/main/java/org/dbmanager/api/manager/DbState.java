package org.dbmanager.api.manager;

/**
 * Lifecycle state of a managed database.
 * <p>
 * The state is derived by the manager from the detected version; it cannot be set directly.
 */
public enum DbState {
    /** The manager has not been initialized or has been closed. */
    UNINITIALIZED,
    /** Ready for use; the database has the newest version supported by the upgrader. */
    READY_NEW,
    /** Ready for use; the database can still be upgraded. */
    READY_OLD,
    /** Ready for use; its version cannot be compared against supported versions. */
    READY_UNKNOWN,
    /** The database does not exist yet (version 0) and can be created by upgrading. */
    NEW,
    /** The database does not exist yet and cannot be created because upgrading is not supported. */
    UNAVAILABLE,
    /** The database version is below the lowest version the upgrader supports. */
    TOO_OLD,
    /** The database version is above the highest version the upgrader supports. */
    TOO_NEW,
    /** The database or its version information is damaged, invalid or could not be detected. */
    DAMAGED_OR_INVALID;

    /**
     * @return true for {@link #READY_NEW}, {@link #READY_OLD} and {@link #READY_UNKNOWN}
     */
    public boolean isReady() {
        return this == READY_NEW || this == READY_OLD || this == READY_UNKNOWN;
    }
}
