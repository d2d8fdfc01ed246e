package org.dbmanager.api.versioning;

import org.dbmanager.api.manager.IDbManager;

/**
 * Performs single-step version upgrades.
 */
public interface IVersionUpgrader {

    int getMinVersion(IDbManager manager);

    int getMaxVersion(IDbManager manager);

    /**
     * Upgrades the database from {@code sourceVersion} to {@code sourceVersion + 1}.
     *
     * @return true if the step succeeded
     */
    boolean upgrade(IDbManager manager, int sourceVersion);
}
