package org.dbmanager.api.versioning;

import org.dbmanager.api.manager.IDbManager;

/**
 * Detects the current version of a managed database.
 * <p>
 * Damage is signalled by an unsuccessful detection or a negative version, never by throwing.
 */
public interface IVersionDetector {

    VersionDetection detect(IDbManager manager);
}
