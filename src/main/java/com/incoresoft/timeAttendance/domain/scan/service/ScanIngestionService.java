package com.incoresoft.timeAttendance.domain.scan.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.incoresoft.timeAttendance.config.DeviceProps;
import com.incoresoft.timeAttendance.domain.attendance.dto.EmployeeDay;
import com.incoresoft.timeAttendance.domain.attendance.dto.ReconciliationResult;
import com.incoresoft.timeAttendance.domain.attendance.service.DailyReconciler;
import com.incoresoft.timeAttendance.domain.employee.dto.Employee;
import com.incoresoft.timeAttendance.domain.scan.dto.IngestionResult;
import com.incoresoft.timeAttendance.domain.scan.dto.ManualScanRequest;
import com.incoresoft.timeAttendance.domain.scan.dto.ScanEvent;
import com.incoresoft.timeAttendance.domain.scan.dto.TerminalRecordDto;
import com.incoresoft.timeAttendance.domain.shared.NotFoundException;
import com.incoresoft.timeAttendance.domain.sync.dto.SyncErrorKind;
import com.incoresoft.timeAttendance.domain.sync.service.SyncFailureService;
import com.incoresoft.timeAttendance.repository.EmployeeRepository;
import com.incoresoft.timeAttendance.repository.ScanEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Persists terminal records as {@link ScanEvent}s.
 *
 * Records are matched to employees by biometric id, deduplicated on (employee, timestamp)
 * against storage and within the input, and written in batches that each commit on their
 * own. A failing batch does not undo the batches before it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScanIngestionService {
    private static final int RAW_SAMPLE_SIZE = 20;

    private final EmployeeRepository employeeRepository;
    private final ScanEventRepository scanEventRepository;
    private final SyncFailureService failureService;
    private final DailyReconciler reconciler;
    private final TransactionTemplate requiresNewTransactionTemplate;
    private final DeviceProps props;
    private final ObjectMapper objectMapper;

    public IngestionResult ingest(String deviceAddress, List<TerminalRecordDto> records) {
        IngestionResult result = new IngestionResult();

        List<TerminalRecordDto> valid = new ArrayList<>();
        for (TerminalRecordDto r : records) {
            if (r == null || r.getUserId() == null || r.getUserId().isBlank() || r.getTimestamp() == null) {
                result.setMalformed(result.getMalformed() + 1);
                continue;
            }
            result.seen(r.getTimestamp());
            valid.add(r);
        }
        if (result.getMalformed() > 0) {
            log.warn("[SYNC] Skipped {} malformed records from {}", result.getMalformed(), deviceAddress);
        }
        if (valid.isEmpty()) return result;

        Set<String> deviceIds = valid.stream().map(r -> r.getUserId().trim()).collect(Collectors.toSet());
        Map<String, Employee> employees = employeeRepository.findByBiometricIdIn(deviceIds).stream()
                .collect(Collectors.toMap(Employee::getBiometricId, Function.identity(), (a, b) -> a));

        Map<String, List<TerminalRecordDto>> unmatched = new LinkedHashMap<>();
        Map<EmployeeDayTime, ScanEvent> candidates = new LinkedHashMap<>();
        for (TerminalRecordDto r : valid) {
            Employee employee = employees.get(r.getUserId().trim());
            if (employee == null) {
                unmatched.computeIfAbsent(r.getUserId().trim(), k -> new ArrayList<>()).add(r);
                continue;
            }
            EmployeeDayTime key = new EmployeeDayTime(employee.getId(), r.getTimestamp());
            if (candidates.containsKey(key)) {
                result.setDuplicates(result.getDuplicates() + 1);
                continue;
            }
            candidates.put(key, ScanEvent.of(employee.getId(), r.getTimestamp(),
                    ScanClassifier.fromPunch(r.getPunch()), deviceAddress));
        }

        for (Map.Entry<String, List<TerminalRecordDto>> entry : unmatched.entrySet()) {
            result.setUnmatched(result.getUnmatched() + entry.getValue().size());
            failureService.recordUnmatched(deviceAddress, entry.getKey(), entry.getValue().size(), rawSample(entry.getValue()));
        }
        if (!unmatched.isEmpty()) {
            log.warn("[SYNC] {} records from {} device users matched no employee: {}",
                    result.getUnmatched(), unmatched.size(), unmatched.keySet());
        }

        List<ScanEvent> pending = new ArrayList<>(candidates.values());
        int batchSize = Math.max(1, props.getBatchSize());
        for (int from = 0; from < pending.size(); from += batchSize) {
            List<ScanEvent> batch = pending.subList(from, Math.min(from + batchSize, pending.size()));
            try {
                List<ScanEvent> saved = requiresNewTransactionTemplate.execute(status -> persistBatch(batch));
                int added = saved == null ? 0 : saved.size();
                result.setRecordsAdded(result.getRecordsAdded() + added);
                result.setDuplicates(result.getDuplicates() + batch.size() - added);
                if (saved != null) {
                    saved.forEach(s -> result.getTouchedDays().add(new EmployeeDay(s.getEmployeeId(), s.getTimestamp().toLocalDate())));
                }
            } catch (Exception ex) {
                String message = "Batch of " + batch.size() + " scans starting at offset " + from + " failed: " + ex.getMessage();
                log.error("[SYNC] {}", message, ex);
                result.getErrors().add(message);
                failureService.record(SyncErrorKind.SYNC_ERROR, message, deviceAddress, null, rawScans(batch));
            }
        }
        log.info("[SYNC] Ingested from {}: {} added, {} duplicates, {} unmatched",
                deviceAddress, result.getRecordsAdded(), result.getDuplicates(), result.getUnmatched());
        return result;
    }

    /**
     * Stores an administrator-entered scan and reconciles its day. When the entry answers a
     * failure event, that event must exist and is marked resolved once the day is reconciled.
     */
    public ReconciliationResult recordManualScan(ManualScanRequest request) {
        Employee employee = employeeRepository.findById(request.getEmployeeId())
                .orElseThrow(() -> NotFoundException.employee(request.getEmployeeId()));
        if (request.getFailureId() != null) {
            failureService.get(request.getFailureId());
        }
        if (scanEventRepository.existsByEmployeeIdAndTimestamp(employee.getId(), request.getTimestamp())) {
            throw new DuplicateScanException(employee.getId(), request.getTimestamp());
        }

        ScanEvent scan = ScanEvent.of(employee.getId(), request.getTimestamp(),
                ScanClassifier.resolve(request.getDirection(), request.getTimestamp()), ScanEvent.MANUAL_DEVICE);
        scan.setManual(true);
        scan.setManualReason(request.getReason());
        try {
            requiresNewTransactionTemplate.executeWithoutResult(status -> scanEventRepository.save(scan));
        } catch (DataIntegrityViolationException ex) {
            // lost the race against a concurrent entry for the same instant
            throw new DuplicateScanException(employee.getId(), request.getTimestamp(), ex);
        }
        log.info("[SYNC] Manual {} scan for employee {} at {}: {}",
                scan.getDirection().getCode(), employee.getId(), request.getTimestamp(), request.getReason());

        ReconciliationResult result = reconciler.reconcileDay(employee, request.getTimestamp().toLocalDate());
        if (request.getFailureId() != null) {
            failureService.resolve(request.getFailureId(), "Manual entry: " + request.getReason(), true);
        }
        return result;
    }

    private List<ScanEvent> persistBatch(List<ScanEvent> batch) {
        Set<Long> employeeIds = new HashSet<>();
        Set<LocalDateTime> timestamps = new HashSet<>();
        for (ScanEvent s : batch) {
            employeeIds.add(s.getEmployeeId());
            timestamps.add(s.getTimestamp());
        }
        Set<EmployeeDayTime> stored = scanEventRepository.findByEmployeeIdInAndTimestampIn(employeeIds, timestamps).stream()
                .map(s -> new EmployeeDayTime(s.getEmployeeId(), s.getTimestamp()))
                .collect(Collectors.toSet());

        List<ScanEvent> fresh = batch.stream()
                .filter(s -> !stored.contains(new EmployeeDayTime(s.getEmployeeId(), s.getTimestamp())))
                .toList();
        if (fresh.isEmpty()) return List.of();
        return scanEventRepository.saveAll(fresh);
    }

    private String rawSample(List<TerminalRecordDto> records) {
        return toJson(records.subList(0, Math.min(RAW_SAMPLE_SIZE, records.size())));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            log.warn("[SYNC] Could not serialize raw records: {}", ex.getMessage());
            return null;
        }
    }

    private String rawScans(List<ScanEvent> batch) {
        List<Map<String, Object>> raw = batch.stream()
                .limit(RAW_SAMPLE_SIZE)
                .map(s -> Map.<String, Object>of("employee_id", s.getEmployeeId(), "timestamp", s.getTimestamp()))
                .toList();
        return toJson(raw);
    }

    private record EmployeeDayTime(Long employeeId, LocalDateTime timestamp) {
    }
}
