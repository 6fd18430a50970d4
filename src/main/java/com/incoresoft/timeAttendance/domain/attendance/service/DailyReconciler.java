package com.incoresoft.timeAttendance.domain.attendance.service;

import com.incoresoft.timeAttendance.config.AttendanceProps;
import com.incoresoft.timeAttendance.domain.attendance.dto.AttendanceStatus;
import com.incoresoft.timeAttendance.domain.attendance.dto.BatchReconciliationResult;
import com.incoresoft.timeAttendance.domain.attendance.dto.DailyAttendanceRecord;
import com.incoresoft.timeAttendance.domain.attendance.dto.EmployeeDay;
import com.incoresoft.timeAttendance.domain.attendance.dto.ReconciliationResult;
import com.incoresoft.timeAttendance.domain.employee.dto.Employee;
import com.incoresoft.timeAttendance.domain.request.dto.LeaveRequest;
import com.incoresoft.timeAttendance.domain.request.dto.PermissionRequest;
import com.incoresoft.timeAttendance.domain.request.dto.RequestStatus;
import com.incoresoft.timeAttendance.domain.scan.dto.ScanEvent;
import com.incoresoft.timeAttendance.domain.scan.service.ScanClassifier;
import com.incoresoft.timeAttendance.domain.shared.NotFoundException;
import com.incoresoft.timeAttendance.repository.DailyAttendanceRecordRepository;
import com.incoresoft.timeAttendance.repository.EmployeeRepository;
import com.incoresoft.timeAttendance.repository.LeaveRequestRepository;
import com.incoresoft.timeAttendance.repository.PermissionRequestRepository;
import com.incoresoft.timeAttendance.repository.ScanEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.Lock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns the raw scans of one (employee, date) into that day's {@link DailyAttendanceRecord}.
 *
 * Each day is reconciled in its own REQUIRES_NEW transaction while holding the day's
 * stripe lock, so a failing day rolls back alone and two writers of the same day never
 * interleave. Re-running a day over the same scans produces the same record.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DailyReconciler {
    private static final Set<RequestStatus> APPROVED = EnumSet.of(RequestStatus.APPROVED);
    private static final int LEAVE_REASON_WIDTH = 50;
    private static final int PERMISSION_REASON_WIDTH = 30;

    private final EmployeeRepository employeeRepository;
    private final ScanEventRepository scanEventRepository;
    private final DailyAttendanceRecordRepository recordRepository;
    private final LeaveRequestRepository leaveRequestRepository;
    private final PermissionRequestRepository permissionRequestRepository;
    private final AttendanceProps props;
    private final TransactionTemplate requiresNewTransactionTemplate;
    private final DayLockRegistry locks;

    /**
     * @throws NotFoundException       unknown employee
     * @throws ReconciliationException the day could not be written
     */
    public ReconciliationResult reconcileDay(Long employeeId, LocalDate date) {
        Employee employee = employeeRepository.findById(employeeId)
                .orElseThrow(() -> NotFoundException.employee(employeeId));
        return reconcileDay(employee, date);
    }

    public ReconciliationResult reconcileDay(Employee employee, LocalDate date) {
        if (!employee.hasJoinedBy(date)) {
            return ReconciliationResult.notApplicable(employee.getId(), date);
        }
        Lock lock = locks.lockFor(new EmployeeDay(employee.getId(), date));
        lock.lock();
        try {
            return requiresNewTransactionTemplate.execute(status -> reconcileInTransaction(employee.getId(), date));
        } catch (RuntimeException ex) {
            throw new ReconciliationException(employee.getId(), date, ex);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reconciles every listed day. A failing day is logged and reported in the result;
     * the remaining days are still processed.
     */
    public BatchReconciliationResult reconcileDays(Collection<EmployeeDay> days) {
        BatchReconciliationResult result = new BatchReconciliationResult();
        if (days.isEmpty()) return result;

        Set<Long> employeeIds = days.stream().map(EmployeeDay::employeeId).collect(Collectors.toSet());
        Map<Long, Employee> employees = employeeRepository.findAllById(employeeIds).stream()
                .collect(Collectors.toMap(Employee::getId, Function.identity()));

        TreeSet<EmployeeDay> ordered = new TreeSet<>(
                Comparator.comparing(EmployeeDay::employeeId).thenComparing(EmployeeDay::date));
        ordered.addAll(days);

        for (EmployeeDay day : ordered) {
            Employee employee = employees.get(day.employeeId());
            if (employee == null) {
                result.fail(day, "Employee " + day.employeeId() + " not found");
                continue;
            }
            try {
                result.count(reconcileDay(employee, day.date()));
            } catch (Exception ex) {
                log.error("[RECONCILE] Failed employee {} on {}: {}", day.employeeId(), day.date(), ex.getMessage(), ex);
                result.fail(day, ex.getMessage());
            }
        }
        log.info("[RECONCILE] Batch of {} days: {} reconciled, {} without scans, {} before joining, {} failed",
                ordered.size(), result.getReconciled(), result.getNoRecord(), result.getNotApplicable(), result.getFailures().size());
        return result;
    }

    /**
     * Re-runs reconciliation for every date in [start, end].
     */
    public BatchReconciliationResult reprocess(Long employeeId, LocalDate start, LocalDate end) {
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start must not be after end");
        }
        if (!employeeRepository.existsById(employeeId)) {
            throw NotFoundException.employee(employeeId);
        }
        List<EmployeeDay> days = start.datesUntil(end.plusDays(1))
                .map(d -> new EmployeeDay(employeeId, d))
                .toList();
        return reconcileDays(days);
    }

    private ReconciliationResult reconcileInTransaction(Long employeeId, LocalDate date) {
        List<ScanEvent> scans = scanEventRepository.findForDay(employeeId, date.atStartOfDay(), date.plusDays(1).atStartOfDay());
        if (scans.isEmpty()) {
            return ReconciliationResult.noRecord(employeeId, date);
        }

        for (int i = 0; i < scans.size(); i++) {
            ScanEvent scan = scans.get(i);
            scan.setSequenceIndex(i + 1);
            scan.setExtraScan(i + 1 > 2);
            scan.setDirection(ScanClassifier.resolve(scan.getDirection(), scan.getTimestamp()));
        }
        scanEventRepository.saveAll(scans);

        ScanPairing pairing = ScanPairing.of(scans);
        boolean incomplete = scans.size() == 1;

        DailyAttendanceRecord record = recordRepository.findByEmployeeIdAndDate(employeeId, date)
                .orElseGet(() -> new DailyAttendanceRecord(employeeId, date));
        record.setFirstCheckIn(pairing.firstCheckIn());
        record.setLastCheckOut(pairing.lastCheckOut());
        record.setFirstScanAt(scans.get(0).getTimestamp());
        record.setLastScanAt(scans.get(scans.size() - 1).getTimestamp());
        record.setTotalWorkedMinutes(pairing.workedMinutes());
        record.setEntryPairCount(pairing.pairCount());
        record.setIncompleteDay(incomplete);

        Optional<LeaveRequest> leave = leaveRequestRepository.findOverlapping(employeeId, APPROVED, date, date)
                .stream().filter(l -> l.covers(date)).findFirst();
        Optional<PermissionRequest> permission = leave.isPresent() ? Optional.empty()
                : permissionRequestRepository.findOverlapping(employeeId, APPROVED, date.atStartOfDay(), date.plusDays(1).atStartOfDay())
                .stream().filter(p -> p.covers(date)).findFirst();

        if (leave.isPresent()) {
            record.setStatus(AttendanceStatus.LEAVE);
            record.setStatusReason("Approved Leave: " + abbreviate(leave.get().getReason(), LEAVE_REASON_WIDTH));
        } else if (permission.isPresent()) {
            record.setStatus(AttendanceStatus.PERMISSION);
            record.setStatusReason(String.format(Locale.ROOT, "Approved Permission (%.1fh): %s",
                    permission.get().durationHours(), abbreviate(permission.get().getReason(), PERMISSION_REASON_WIDTH)));
        } else {
            record.setStatus(statusFromScans(pairing));
            record.setStatusReason(reasonFromScans(record.getStatus(), pairing, incomplete));
        }

        DailyAttendanceRecord saved = recordRepository.save(record);
        log.debug("[RECONCILE] employee {} on {}: {} scans, {} min, status {}",
                employeeId, date, scans.size(), pairing.workedMinutes(), saved.getStatus().getCode());
        return ReconciliationResult.reconciled(saved);
    }

    AttendanceStatus statusFromScans(ScanPairing pairing) {
        if (pairing.activeCheckIn()) return AttendanceStatus.IN_OFFICE;
        if (pairing.firstCheckIn() != null && pairing.lastCheckOut() != null) {
            double hours = pairing.workedMinutes() / 60.0;
            if (hours >= props.getFullDayHours()) return AttendanceStatus.PRESENT;
            if (hours >= props.getHalfDayHours()) return AttendanceStatus.HALF_DAY;
            return AttendanceStatus.PARTIAL;
        }
        if (pairing.firstCheckIn() != null) return AttendanceStatus.IN_OFFICE;
        return AttendanceStatus.ABSENT;
    }

    private String reasonFromScans(AttendanceStatus status, ScanPairing pairing, boolean incomplete) {
        if (incomplete) {
            return String.format(Locale.ROOT, "Single scan - %.0f hours assigned", props.getStandardWorkdayHours());
        }
        return switch (status) {
            case PRESENT, HALF_DAY, PARTIAL ->
                    String.format(Locale.ROOT, "%.1f hours worked", pairing.workedMinutes() / 60.0);
            case IN_OFFICE -> "Checked in, no check-out yet";
            default -> "Check-out without check-in";
        };
    }

    private static String abbreviate(String text, int width) {
        return StringUtils.abbreviate(StringUtils.defaultString(text), width);
    }
}
