package com.dbdrive.server.service.executor;

import com.dbdrive.server.enums.BackupModeEnum;
import com.dbdrive.server.enums.RunStatusEnum;
import com.dbdrive.server.exception.BusinessException;
import com.dbdrive.server.exception.DbDriveException;
import com.dbdrive.server.exception.ValidationException;
import com.dbdrive.server.model.entity.BackupHistoryEntity;
import com.dbdrive.server.model.entity.JobConfigEntity;
import com.dbdrive.server.model.internal.NotificationEvent;
import com.dbdrive.server.model.internal.StorageFolder;
import com.dbdrive.server.model.internal.UploadResult;
import com.dbdrive.server.service.backup.DatabaseBackup;
import com.dbdrive.server.service.backup.DatabaseBackupFactory;
import com.dbdrive.server.service.notification.NotificationDispatcher;
import com.dbdrive.server.service.storage.StorageService;
import com.dbdrive.server.service.store.ConfigStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Timestamp;
import java.time.Instant;

/**
 * Runs one backup end to end: dump, upload, history, notification.
 * <p>
 * Every run ends with exactly one terminal history write, and the local dump is deleted on
 * every exit path. Collaborator failures are recorded on the history row and never escape
 * {@link #execute(JobConfigEntity)}.
 */
@Slf4j
@Service
public class BackupJobExecutor {

    public static final String FOLDER_PREFIX = "DB Backups - ";

    private static final int MAX_ERROR_LENGTH = 4000;

    private final ConfigStore configStore;

    private final DatabaseBackupFactory databaseBackupFactory;

    private final StorageService storageService;

    private final NotificationDispatcher notificationDispatcher;

    private final Path tempDir;

    @Autowired
    public BackupJobExecutor(
            ConfigStore configStore,
            DatabaseBackupFactory databaseBackupFactory,
            StorageService storageService,
            NotificationDispatcher notificationDispatcher,
            @Value("${dbdrive.server.backup.tempDir:${java.io.tmpdir}/dbdrive}") String tempDir) {
        this.configStore = configStore;
        this.databaseBackupFactory = databaseBackupFactory;
        this.storageService = storageService;
        this.notificationDispatcher = notificationDispatcher;
        this.tempDir = Paths.get(tempDir);
    }

    public BackupHistoryEntity execute(JobConfigEntity jobConfig) throws ValidationException {
        if (ObjectUtils.isEmpty(jobConfig) || StringUtils.isBlank(jobConfig.getJobName())) {
            throw new ValidationException("execute backup failed. jobConfig or jobName is empty");
        }
        String jobName = jobConfig.getJobName();
        Instant startedAt = Instant.now();
        // 1. running
        BackupHistoryEntity history = new BackupHistoryEntity();
        history.setJobName(jobName);
        history.setDatabaseKind(jobConfig.getDatabaseKind());
        history.setStatus(RunStatusEnum.RUNNING.getName());
        history.setStartedAt(Timestamp.from(startedAt));
        try {
            this.configStore.saveOrUpdateHistory(history);
        } catch (DbDriveException e) {
            // the terminal write inserts the row instead
            log.error("execute backup. can't save running history. job is {}", jobName, e);
        }
        log.info("backup started. job is {}, mode is {}", jobName, jobConfig.getBackupMode());
        Path runDir = null;
        Path artifact = null;
        long size = 0L;
        try {
            BackupModeEnum mode = BackupModeEnum.fromMode(jobConfig.getBackupMode());
            if (mode == null) {
                throw new ValidationException("unsupported backup mode %s".formatted(jobConfig.getBackupMode()));
            }
            // 2. dump, into a directory owned by this run
            DatabaseBackup databaseBackup = this.databaseBackupFactory.create(jobConfig.getDatabaseConnectionRef());
            databaseBackup.testConnection();
            runDir = this.createRunDir();
            artifact = databaseBackup.backup(mode, runDir);
            history.setArtifactName(artifact.getFileName().toString());
            // 3. size
            size = this.statSize(artifact);
            history.setArtifactSize(size);
            // 4. folder
            StorageFolder folder = this.storageService.findOrCreateFolder(FOLDER_PREFIX + jobName);
            // 5. upload
            UploadResult uploadResult = this.storageService.upload(artifact, folder);
            // 6. success
            history.setArtifactId(uploadResult.getFileId());
            Instant completedAt = Instant.now();
            this.finish(history, RunStatusEnum.SUCCESS, completedAt, null);
            log.info("backup success. job is {}, artifact is {}, size is {}",
                    jobName, history.getArtifactName(), size);
            this.notificationDispatcher.dispatchSuccess(NotificationEvent.builder()
                    .jobName(jobName)
                    .databaseKind(jobConfig.getDatabaseKind())
                    .outcome(RunStatusEnum.SUCCESS)
                    .sizeBytes(size)
                    .artifactName(history.getArtifactName())
                    .artifactLink(uploadResult.getWebViewLink())
                    .startedAt(startedAt)
                    .completedAt(completedAt)
                    .build());
        } catch (RuntimeException e) {
            String errorMessage = e instanceof DbDriveException ?
                    ((DbDriveException) e).getDbDriveMessage() : e.toString();
            Instant completedAt = Instant.now();
            log.warn("backup failed. job is {}, error is {}", jobName, errorMessage);
            if (!RunStatusEnum.fromName(history.getStatus()).isTerminal()) {
                this.finish(history, RunStatusEnum.FAILED, completedAt, errorMessage);
                this.notificationDispatcher.dispatchFailure(NotificationEvent.builder()
                        .jobName(jobName)
                        .databaseKind(jobConfig.getDatabaseKind())
                        .outcome(RunStatusEnum.FAILED)
                        .sizeBytes(size)
                        .artifactName(history.getArtifactName())
                        .errorMessage(errorMessage)
                        .startedAt(startedAt)
                        .completedAt(completedAt)
                        .build());
            }
        } finally {
            // 7. cleanup
            this.deleteArtifact(artifact);
            this.deleteRunDir(runDir);
        }
        return history;
    }

    // runs of one job may overlap, and so may jobs dumping the same database
    private Path createRunDir() {
        try {
            Files.createDirectories(this.tempDir);
            return Files.createTempDirectory(this.tempDir, "run_");
        } catch (IOException e) {
            throw new BusinessException("create run dir failed. tempDir is %s".formatted(this.tempDir), e);
        }
    }

    private long statSize(Path artifact) {
        try {
            return Files.size(artifact);
        } catch (IOException e) {
            throw new BusinessException(
                    "stat artifact failed. artifact is %s".formatted(artifact), e);
        }
    }

    // status, completedAt and error go out in one update
    private void finish(
            BackupHistoryEntity history,
            RunStatusEnum status,
            Instant completedAt,
            String errorMessage) {
        history.setStatus(status.getName());
        history.setCompletedAt(Timestamp.from(completedAt));
        history.setErrorMessage(StringUtils.abbreviate(errorMessage, MAX_ERROR_LENGTH));
        try {
            this.configStore.saveOrUpdateHistory(history);
        } catch (DbDriveException e) {
            log.error("finish backup failed. can't save {} history. job is {}",
                    status.getName(), history.getJobName(), e);
        }
    }

    private void deleteArtifact(Path artifact) {
        if (artifact == null) {
            return;
        }
        try {
            Files.deleteIfExists(artifact);
        } catch (IOException e) {
            log.error("delete artifact failed. artifact is {}", artifact, e);
        }
    }

    private void deleteRunDir(Path runDir) {
        if (runDir == null) {
            return;
        }
        try {
            FileUtils.deleteDirectory(runDir.toFile());
        } catch (IOException e) {
            log.error("delete run dir failed. runDir is {}", runDir, e);
        }
    }
}
