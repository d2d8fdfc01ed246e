package org.dbmanager.api.cleanup;

import org.dbmanager.api.manager.IDbManager;

/**
 * Performs maintenance on a managed database (statistics, compaction and the like).
 */
public interface ICleanupProcessor {

    boolean cleanup(IDbManager manager);
}
