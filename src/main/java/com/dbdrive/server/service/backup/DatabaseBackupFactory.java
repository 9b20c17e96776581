package com.dbdrive.server.service.backup;

import com.dbdrive.server.exception.ValidationException;

public interface DatabaseBackupFactory {

    DatabaseBackup create(String databaseConnectionRef) throws ValidationException;
}
