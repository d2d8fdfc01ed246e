package org.dbmanager.api.manager;

/**
 * Receives state and version change notifications from an {@link IDbManager}.
 * <p>
 * Called synchronously on the thread performing the change, once per distinct transition.
 */
public interface IDbManagerListener {

    default void stateChanged(IDbManager manager, DbState oldState, DbState newState) {
    }

    default void versionChanged(IDbManager manager, int oldVersion, int newVersion) {
    }
}
