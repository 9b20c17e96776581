package com.dbdrive.server.service.backup;

import com.dbdrive.server.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Picks the backup implementation from the connection ref scheme. Only mysql is supported.
 */
@Slf4j
@Service
public class DatabaseBackupService implements DatabaseBackupFactory {

    @Value("${dbdrive.server.backup.mysqldumpBinary:mysqldump}")
    private String mysqldumpBinary;

    @Value("${dbdrive.server.backup.mysqladminBinary:mysqladmin}")
    private String mysqladminBinary;

    @Value("${dbdrive.server.backup.dumpTimeoutMin:60}")
    private long dumpTimeoutMin;

    @Value("${dbdrive.server.backup.pingTimeoutSec:15}")
    private long pingTimeoutSec;

    @Override
    public DatabaseBackup create(String databaseConnectionRef) throws ValidationException {
        if (StringUtils.isBlank(databaseConnectionRef)) {
            throw new ValidationException("create backup failed. databaseConnectionRef is blank");
        }
        if (!MysqlConnectionInfo.isMysqlRef(databaseConnectionRef)) {
            throw new ValidationException("create backup failed. only mysql connection is supported");
        }
        return new MysqldumpBackup(
                MysqlConnectionInfo.parse(databaseConnectionRef),
                this.mysqldumpBinary,
                this.mysqladminBinary,
                Duration.ofMinutes(this.dumpTimeoutMin),
                Duration.ofSeconds(this.pingTimeoutSec));
    }
}
