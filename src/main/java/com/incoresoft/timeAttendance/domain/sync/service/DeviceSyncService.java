package com.incoresoft.timeAttendance.domain.sync.service;

import com.incoresoft.timeAttendance.config.DeviceProps;
import com.incoresoft.timeAttendance.domain.attendance.dto.BatchReconciliationResult;
import com.incoresoft.timeAttendance.domain.attendance.service.DailyReconciler;
import com.incoresoft.timeAttendance.domain.scan.dto.IngestionResult;
import com.incoresoft.timeAttendance.domain.scan.dto.TerminalRecordDto;
import com.incoresoft.timeAttendance.domain.scan.service.ScanIngestionService;
import com.incoresoft.timeAttendance.domain.sync.dto.AgentSyncRequest;
import com.incoresoft.timeAttendance.domain.sync.dto.DeviceSettings;
import com.incoresoft.timeAttendance.domain.sync.dto.SyncErrorKind;
import com.incoresoft.timeAttendance.domain.sync.dto.SyncResult;
import com.incoresoft.timeAttendance.domain.sync.dto.SyncState;
import com.incoresoft.timeAttendance.domain.sync.dto.SyncStatus;
import com.incoresoft.timeAttendance.repository.DeviceSettingsRepository;
import com.incoresoft.timeAttendance.repository.TerminalApiRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Pulls new records from the active terminal, stores them and reconciles every touched day.
 *
 * At most one sync runs per process. The single permit is taken with tryAcquire, so a
 * second caller gets {@link SyncStatus#ALREADY_RUNNING} immediately and writes nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeviceSyncService {
    private static final String AGENT_DEVICE_PREFIX = "agent:";

    private final DeviceSettingsRepository deviceSettingsRepository;
    private final TerminalApiRepository terminalApiRepository;
    private final RetryTemplate terminalRetryTemplate;
    private final ScanIngestionService ingestionService;
    private final DailyReconciler reconciler;
    private final SyncFailureService failureService;
    private final DeviceProps props;

    private final Semaphore slot = new Semaphore(1);
    private final AtomicReference<SyncState> state = new AtomicReference<>(SyncState.IDLE);
    private volatile SyncResult lastResult;

    /** Periodic pull. Interval is configured in minutes. */
    @Scheduled(fixedDelayString = "${device.sync-interval-minutes:5}",
            initialDelayString = "${device.sync-interval-minutes:5}", timeUnit = TimeUnit.MINUTES)
    public void scheduledSync() {
        if (!props.isAutoSync()) return;
        SyncResult result = sync();
        log.info("[SYNC] Scheduled sync finished: {} ({} added)", result.getStatus().code(), result.getRecordsAdded());
    }

    public SyncResult sync() {
        if (!slot.tryAcquire()) {
            log.info("[SYNC] Sync requested while another one is running");
            return SyncResult.alreadyRunning();
        }
        try {
            SyncResult result = runSync();
            lastResult = result;
            return result;
        } finally {
            slot.release();
        }
    }

    public boolean isRunning() {
        return slot.availablePermits() == 0;
    }

    public SyncState getState() {
        return state.get();
    }

    public Optional<SyncResult> getLastResult() {
        return Optional.ofNullable(lastResult);
    }

    /**
     * Records pushed by the on-site agent. Goes through the same ingestion and
     * reconciliation as a pull but does not take the sync permit: the agent has already
     * read the device, and deduplication makes overlap with a running pull harmless.
     */
    public SyncResult acceptAgentPush(AgentSyncRequest request) {
        String deviceAddress = AGENT_DEVICE_PREFIX + (request.getDeviceId() == null ? "unknown" : request.getDeviceId());
        try {
            IngestionResult ingestion = ingestionService.ingest(deviceAddress, request.getLogs());
            return reconcileTouchedDays(deviceAddress, ingestion);
        } catch (Exception ex) {
            String message = "Agent push from " + deviceAddress + " failed: " + ex.getMessage();
            log.error("[SYNC] {}", message, ex);
            failureService.record(SyncErrorKind.SYNC_ERROR, message, deviceAddress, null, null);
            return SyncResult.error(message);
        }
    }

    private SyncResult runSync() {
        state.set(SyncState.CONNECTING);
        Optional<DeviceSettings> active = deviceSettingsRepository.findFirstByActiveTrueOrderByIdAsc();
        if (active.isEmpty()) {
            return fail(SyncErrorKind.CONFIG_ERROR, "No active device configured", null, null);
        }
        DeviceSettings device = active.get();
        String address = device.getDeviceAddress();

        List<TerminalRecordDto> records;
        try {
            records = terminalRetryTemplate.execute(ctx -> {
                if (ctx.getRetryCount() > 0) {
                    log.warn("[SYNC] Retrying {} (attempt {}): {}", address, ctx.getRetryCount() + 1,
                            ctx.getLastThrowable() == null ? "" : ctx.getLastThrowable().getMessage());
                }
                return terminalApiRepository.getAllAttendanceSince(address, device.getLastSyncAt(), props.getPageLimit());
            });
        } catch (ResourceAccessException | HttpServerErrorException ex) {
            return fail(SyncErrorKind.CONNECTION_ERROR,
                    "Device " + address + " unreachable after " + props.getConnectAttempts() + " attempts: " + ex.getMessage(),
                    address, ex);
        } catch (Exception ex) {
            return fail(SyncErrorKind.SYNC_ERROR, "Fetching from " + address + " failed: " + ex.getMessage(), address, ex);
        }

        try {
            state.set(SyncState.SYNCING);
            IngestionResult ingestion = ingestionService.ingest(address, records);

            state.set(SyncState.COMMITTING);
            SyncResult result = reconcileTouchedDays(address, ingestion);
            // a failed batch keeps the watermark so its records are fetched again
            if (ingestion.getErrors().isEmpty()) {
                advanceWatermark(device, ingestion.getNewestTimestamp());
            }
            state.set(SyncState.IDLE);
            log.info("[SYNC] Sync of {} done: {} fetched, {} added, {} duplicates, {} unmatched, {} days reconciled",
                    address, records.size(), result.getRecordsAdded(), result.getDuplicates(),
                    result.getUnmatched(), result.getDaysReconciled());
            return result;
        } catch (Exception ex) {
            return fail(SyncErrorKind.SYNC_ERROR, "Sync of " + address + " failed: " + ex.getMessage(), address, ex);
        }
    }

    private SyncResult reconcileTouchedDays(String deviceAddress, IngestionResult ingestion) {
        BatchReconciliationResult reconciliation = reconciler.reconcileDays(ingestion.getTouchedDays());

        SyncResult.SyncResultBuilder result = SyncResult.builder()
                .status(SyncStatus.SUCCESS)
                .message(ingestion.getRecordsAdded() + " new scans from " + deviceAddress)
                .recordsAdded(ingestion.getRecordsAdded())
                .duplicates(ingestion.getDuplicates())
                .unmatched(ingestion.getUnmatched())
                .daysReconciled(reconciliation.getReconciled())
                .errors(ingestion.getErrors());

        for (BatchReconciliationResult.Failure f : reconciliation.getFailures()) {
            String message = "Reconciliation of employee " + f.employeeId() + " on " + f.date() + " failed: " + f.message();
            failureService.record(SyncErrorKind.RECONCILIATION_ERROR, message, deviceAddress, String.valueOf(f.employeeId()), null);
            result.error(message);
        }
        return result.build();
    }

    private void advanceWatermark(DeviceSettings device, LocalDateTime newest) {
        if (newest == null) return;
        if (device.getLastSyncAt() != null && !newest.isAfter(device.getLastSyncAt())) return;
        device.setLastSyncAt(newest);
        deviceSettingsRepository.save(device);
    }

    private SyncResult fail(SyncErrorKind kind, String message, String deviceAddress, Exception ex) {
        state.set(SyncState.FAILED);
        if (ex != null) {
            log.error("[SYNC] {}: {}", kind, message, ex);
        } else {
            log.error("[SYNC] {}: {}", kind, message);
        }
        failureService.record(kind, message, deviceAddress, null, null);
        return SyncResult.error(message);
    }
}
