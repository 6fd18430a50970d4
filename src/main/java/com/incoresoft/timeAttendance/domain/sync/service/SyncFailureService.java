package com.incoresoft.timeAttendance.domain.sync.service;

import com.incoresoft.timeAttendance.domain.shared.NotFoundException;
import com.incoresoft.timeAttendance.domain.sync.dto.SyncErrorKind;
import com.incoresoft.timeAttendance.domain.sync.dto.SyncFailureEvent;
import com.incoresoft.timeAttendance.notification.AdminNotificationService;
import com.incoresoft.timeAttendance.repository.SyncFailureEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Failure audit trail and the administrator alerts that go with it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncFailureService {
    private static final int MESSAGE_WIDTH = 1000;
    private static final int DEFAULT_LOOKBACK_DAYS = 30;

    private final SyncFailureEventRepository repository;
    private final AdminNotificationService notifier;
    private final Clock clock;

    public SyncFailureEvent record(SyncErrorKind kind, String message, String deviceAddress,
                                   String employeeId, String rawPayload) {
        SyncFailureEvent event = new SyncFailureEvent();
        event.setErrorKind(kind);
        event.setMessage(StringUtils.abbreviate(StringUtils.defaultString(message), MESSAGE_WIDTH));
        event.setDeviceAddress(deviceAddress);
        event.setEmployeeId(employeeId);
        event.setRawPayload(rawPayload);
        event.setCreatedAt(LocalDateTime.now(clock));

        SyncFailureEvent saved = event;
        try {
            saved = repository.save(event);
        } catch (Exception ex) {
            log.error("[SYNC] Could not persist {} failure event ({}): {}", kind, message, ex.getMessage(), ex);
        }

        if (kind.notifiesAdmins()) {
            notifier.notifyAdmins(formatAlert(saved));
        }
        return saved;
    }

    /**
     * Records an unmatched device id unless an unresolved event for the same device and id
     * is already open.
     *
     * @return true when a new event was written
     */
    public boolean recordUnmatched(String deviceAddress, String biometricId, int records, String rawPayload) {
        if (repository.existsByErrorKindAndDeviceAddressAndEmployeeIdAndResolvedFalse(
                SyncErrorKind.UNMATCHED_EMPLOYEE, deviceAddress, biometricId)) {
            log.debug("[SYNC] Unmatched id {} on {} already open", biometricId, deviceAddress);
            return false;
        }
        record(SyncErrorKind.UNMATCHED_EMPLOYEE,
                records + " record(s) for device user " + biometricId + " match no employee",
                deviceAddress, biometricId, rawPayload);
        return true;
    }

    /**
     * Events created in [from, to] (whole days), newest first. Missing bounds default to
     * the last 30 days.
     */
    @Transactional(readOnly = true)
    public List<SyncFailureEvent> find(LocalDate from, LocalDate to, Boolean resolved) {
        LocalDate end = to != null ? to : LocalDate.now(clock);
        LocalDate start = from != null ? from : end.minusDays(DEFAULT_LOOKBACK_DAYS);
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        LocalDateTime fromTs = start.atStartOfDay();
        LocalDateTime toTs = end.plusDays(1).atStartOfDay().minusNanos(1);
        return resolved == null
                ? repository.findByCreatedAtBetweenOrderByCreatedAtDesc(fromTs, toTs)
                : repository.findByCreatedAtBetweenAndResolvedOrderByCreatedAtDesc(fromTs, toTs, resolved);
    }

    @Transactional(readOnly = true)
    public SyncFailureEvent get(Long id) {
        return repository.findById(id)
                .orElseThrow(() -> new NotFoundException("Sync failure " + id + " not found"));
    }

    @Transactional
    public SyncFailureEvent resolve(Long id, String note, boolean manualEntry) {
        SyncFailureEvent event = get(id);
        event.setResolved(true);
        event.setResolutionNote(note);
        event.setManualEntry(event.isManualEntry() || manualEntry);
        log.info("[SYNC] Failure {} resolved{}", id, manualEntry ? " by manual entry" : "");
        return repository.save(event);
    }

    static String formatAlert(SyncFailureEvent event) {
        StringBuilder sb = new StringBuilder("⚠️ Attendance sync failure: ").append(event.getErrorKind());
        if (event.getDeviceAddress() != null) sb.append("\nDevice: ").append(event.getDeviceAddress());
        if (event.getEmployeeId() != null) sb.append("\nEmployee: ").append(event.getEmployeeId());
        sb.append("\n").append(event.getMessage());
        return sb.toString();
    }
}
