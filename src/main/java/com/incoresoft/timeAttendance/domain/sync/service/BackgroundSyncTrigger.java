package com.incoresoft.timeAttendance.domain.sync.service;

import com.incoresoft.timeAttendance.domain.sync.dto.SyncResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Fire-and-forget sync for read paths. Never waits for the sync and never lets its
 * failure reach the caller.
 */
@Slf4j
@Component
public class BackgroundSyncTrigger {
    private final DeviceSyncService syncService;
    private final TaskExecutor syncExecutor;

    public BackgroundSyncTrigger(DeviceSyncService syncService, @Qualifier("syncExecutor") TaskExecutor syncExecutor) {
        this.syncService = syncService;
        this.syncExecutor = syncExecutor;
    }

    /**
     * @return true when a sync was queued; false when one is already running or queued
     */
    public boolean requestBackgroundSync() {
        if (syncService.isRunning()) {
            return false;
        }
        try {
            syncExecutor.execute(this::runQuietly);
            return true;
        } catch (TaskRejectedException ex) {
            log.debug("[SYNC] Background sync already queued");
            return false;
        }
    }

    private void runQuietly() {
        try {
            SyncResult result = syncService.sync();
            log.debug("[SYNC] Background sync finished: {}", result.getStatus().code());
        } catch (Exception ex) {
            log.error("[SYNC] Background sync failed: {}", ex.getMessage(), ex);
        }
    }
}
