package com.dbdrive.server.service.scheduler;

import com.dbdrive.server.model.internal.ScheduledJobInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Job name -> live trigger. At most one entry per name: replacing an entry cancels the old
 * trigger and arms the new one inside a single write lock section.
 * <p>
 * While the clock is stopped entries are kept but not armed.
 */
@Slf4j
public class ScheduledJobRegistry {

    private final Map<String, ScheduledEntry> entries = new LinkedHashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    // null while stopped
    private TaskScheduler clock;

    public void replace(ScheduledEntry entry) {
        this.lock.writeLock().lock();
        try {
            ScheduledEntry previous = this.entries.remove(entry.getJobName());
            if (previous != null) {
                previous.cancel();
            }
            this.entries.put(entry.getJobName(), entry);
            if (this.clock != null) {
                entry.arm(this.clock);
            }
        } finally {
            this.lock.writeLock().unlock();
        }
    }

    public boolean remove(String jobName) {
        this.lock.writeLock().lock();
        try {
            ScheduledEntry previous = this.entries.remove(jobName);
            if (previous == null) {
                return false;
            }
            previous.cancel();
            return true;
        } finally {
            this.lock.writeLock().unlock();
        }
    }

    public void startClock(TaskScheduler taskScheduler) {
        this.lock.writeLock().lock();
        try {
            this.clock = taskScheduler;
            this.entries.values().forEach(entry -> entry.arm(taskScheduler));
        } finally {
            this.lock.writeLock().unlock();
        }
    }

    public void stopClock() {
        this.lock.writeLock().lock();
        try {
            this.clock = null;
            this.entries.values().forEach(ScheduledEntry::cancel);
        } finally {
            this.lock.writeLock().unlock();
        }
    }

    public boolean contains(String jobName) {
        this.lock.readLock().lock();
        try {
            return this.entries.containsKey(jobName);
        } finally {
            this.lock.readLock().unlock();
        }
    }

    public int size() {
        this.lock.readLock().lock();
        try {
            return this.entries.size();
        } finally {
            this.lock.readLock().unlock();
        }
    }

    public List<ScheduledJobInfo> snapshot() {
        this.lock.readLock().lock();
        try {
            List<ScheduledJobInfo> result = new ArrayList<>(this.entries.size());
            this.entries.values().forEach(entry -> result.add(entry.toInfo()));
            return Collections.unmodifiableList(result);
        } finally {
            this.lock.readLock().unlock();
        }
    }
}
