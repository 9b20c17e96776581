package com.dbdrive.server.service.backup;

import com.dbdrive.server.enums.BackupModeEnum;
import com.dbdrive.server.exception.BusinessException;
import com.dbdrive.server.exception.ValidationException;
import com.dbdrive.server.model.internal.CommandResult;
import com.dbdrive.server.util.CommandUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.exec.CommandLine;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * mysqldump based backup. The password travels through {@code MYSQL_PWD} so it never shows up
 * in the process list.
 */
@Slf4j
public class MysqldumpBackup implements DatabaseBackup {

    private static final DateTimeFormatter TIMESTAMP_FORMATTER = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final MysqlConnectionInfo connectionInfo;

    private final String mysqldumpBinary;

    private final String mysqladminBinary;

    private final Duration dumpTimeout;

    private final Duration pingTimeout;

    public MysqldumpBackup(
            MysqlConnectionInfo connectionInfo,
            String mysqldumpBinary,
            String mysqladminBinary,
            Duration dumpTimeout,
            Duration pingTimeout) {
        this.connectionInfo = connectionInfo;
        this.mysqldumpBinary = mysqldumpBinary;
        this.mysqladminBinary = mysqladminBinary;
        this.dumpTimeout = dumpTimeout;
        this.pingTimeout = pingTimeout;
    }

    @Override
    public void testConnection() throws BusinessException {
        CommandLine commandLine = new CommandLine(this.mysqladminBinary);
        this.addConnectionArguments(commandLine);
        commandLine.addArgument("ping");
        CommandResult commandResult = CommandUtil.execute(commandLine, this.genEnv(), this.pingTimeout);
        if (!commandResult.isSuccess()) {
            throw new BusinessException("testConnection failed. host is %s:%d, exit code is %d, error is %s"
                    .formatted(
                            this.connectionInfo.getHost(),
                            this.connectionInfo.getPort(),
                            commandResult.getExitCode(),
                            commandResult.getError()));
        }
        log.debug("testConnection success. host is {}:{}", this.connectionInfo.getHost(), this.connectionInfo.getPort());
    }

    @Override
    public Path backup(BackupModeEnum mode, Path outputDir) throws BusinessException {
        if (mode == null || outputDir == null) {
            throw new ValidationException("backup failed. mode or outputDir is null");
        }
        // 1. output file, {db}_backup_{ts}.sql or {db}_schema_{ts}.sql
        Path artifact;
        try {
            Files.createDirectories(outputDir);
            artifact = outputDir.resolve(this.artifactName(mode));
        } catch (IOException e) {
            throw new BusinessException("backup failed. can't create outputDir %s".formatted(outputDir), e);
        }
        // 2. never truncate a dump someone else is writing
        OutputStream artifactStream;
        try {
            artifactStream = Files.newOutputStream(artifact, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new BusinessException("backup failed. can't create artifact %s".formatted(artifact), e);
        }
        // 3. mysqldump writes to stdout, piped into the file
        CommandLine commandLine = this.buildDumpCommandLine(mode);
        CommandResult commandResult;
        try (OutputStream outputStream = artifactStream) {
            commandResult = CommandUtil.execute(commandLine, this.genEnv(), outputStream, this.dumpTimeout);
        } catch (IOException e) {
            FileUtils.deleteQuietly(artifact.toFile());
            throw new BusinessException("backup failed. can't write artifact %s".formatted(artifact), e);
        }
        if (!commandResult.isSuccess()) {
            FileUtils.deleteQuietly(artifact.toFile());
            throw new BusinessException("backup failed. mysqldump exit code is %d, error is %s"
                    .formatted(commandResult.getExitCode(), commandResult.getError()));
        }
        return artifact;
    }

    String artifactName(BackupModeEnum mode) {
        String kind = mode == BackupModeEnum.SCHEMA_ONLY ? "schema" : "backup";
        return "%s_%s_%s.sql".formatted(
                this.connectionInfo.getDatabase(),
                kind,
                LocalDateTime.now().format(TIMESTAMP_FORMATTER));
    }

    CommandLine buildDumpCommandLine(BackupModeEnum mode) {
        CommandLine commandLine = new CommandLine(this.mysqldumpBinary);
        this.addConnectionArguments(commandLine);
        if (mode == BackupModeEnum.SCHEMA_ONLY) {
            commandLine.addArgument("--no-data");
        } else {
            commandLine.addArgument("--single-transaction");
        }
        commandLine.addArgument("--routines");
        commandLine.addArgument("--triggers");
        commandLine.addArgument(this.connectionInfo.getDatabase(), false);
        return commandLine;
    }

    private void addConnectionArguments(CommandLine commandLine) {
        commandLine.addArgument("--user=" + this.connectionInfo.getUser(), false);
        commandLine.addArgument("--host=" + this.connectionInfo.getHost(), false);
        commandLine.addArgument("--port=" + this.connectionInfo.getPort());
    }

    private Map<String, String> genEnv() {
        return Map.of("MYSQL_PWD", this.connectionInfo.getPassword());
    }
}
