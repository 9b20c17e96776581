package com.dbdrive.server.configuration;

import com.dbdrive.server.service.scheduler.BackupScheduler;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

@Configuration
@Slf4j
public class ApplicationLifeCycleConfig {

    @Value("${spring.profiles.active:prod}")
    private String activeProfile;

    @Value("${dbdrive.server.scheduler.autoStart:true}")
    private boolean schedulerAutoStart;

    private final BackupScheduler backupScheduler;

    @Autowired
    public ApplicationLifeCycleConfig(BackupScheduler backupScheduler) {
        this.backupScheduler = backupScheduler;
    }

    // after the context is ready, so schema.sql has run
    @EventListener(ApplicationReadyEvent.class)
    public void startUp() {
        log.info("Starting up {} environment", this.activeProfile);
        if (!this.schedulerAutoStart) {
            log.info("scheduler auto start is off");
            return;
        }
        this.backupScheduler.start();
    }

    @PreDestroy
    public void shutDown() {
        this.backupScheduler.stop();
    }
}
