package org.dbmanager.api.backup;

import org.dbmanager.api.manager.IDbManager;

/**
 * Creates backups of a managed database and restores them.
 * <p>
 * The meaning of the backup target or source (a file path, a stream, ...) is defined by the
 * implementation.
 */
public interface IBackupCreator {

    boolean supportsBackup();

    boolean supportsRestore();

    boolean backup(IDbManager manager, Object backupTarget);

    boolean restore(IDbManager manager, Object backupSource);
}
