package com.dbdrive.server.service.backup;

import com.dbdrive.server.enums.BackupModeEnum;
import com.dbdrive.server.exception.BusinessException;

import java.nio.file.Path;

/**
 * Produces a local dump of one database. Bound to a single connection.
 */
public interface DatabaseBackup {

    void testConnection() throws BusinessException;

    /**
     * Writes the dump into {@code outputDir} and returns the artifact path. The caller owns the
     * returned file and deletes it.
     */
    Path backup(BackupModeEnum mode, Path outputDir) throws BusinessException;
}
