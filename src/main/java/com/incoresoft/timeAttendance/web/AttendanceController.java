package com.incoresoft.timeAttendance.web;

import com.incoresoft.timeAttendance.domain.attendance.dto.BatchReconciliationResult;
import com.incoresoft.timeAttendance.domain.attendance.dto.ReconciliationResult;
import com.incoresoft.timeAttendance.domain.attendance.service.DailyReconciler;
import com.incoresoft.timeAttendance.domain.calendar.dto.DayContext;
import com.incoresoft.timeAttendance.domain.calendar.service.CalendarContextResolver;
import com.incoresoft.timeAttendance.domain.calendar.service.EmployeeCalendarLoader;
import com.incoresoft.timeAttendance.domain.scan.dto.ManualScanRequest;
import com.incoresoft.timeAttendance.domain.scan.service.ScanIngestionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/attendance")
@RequiredArgsConstructor
public class AttendanceController {
    private final DailyReconciler reconciler;
    private final ScanIngestionService ingestionService;
    private final EmployeeCalendarLoader calendarLoader;
    private final CalendarContextResolver resolver;

    /**
     * POST http://localhost:8080/api/attendance/12/reconcile?date=2025-11-02
     */
    @PostMapping("/{employeeId}/reconcile")
    public ReconciliationResult reconcile(
            @PathVariable Long employeeId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return reconciler.reconcileDay(employeeId, date);
    }

    /**
     * POST http://localhost:8080/api/attendance/12/reprocess?start=2025-11-01&end=2025-11-30
     */
    @PostMapping("/{employeeId}/reprocess")
    public BatchReconciliationResult reprocess(
            @PathVariable Long employeeId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end
    ) {
        return reconciler.reprocess(employeeId, start, end);
    }

    @PostMapping("/manual-entry")
    @ResponseStatus(HttpStatus.CREATED)
    public ReconciliationResult manualEntry(@Valid @RequestBody ManualScanRequest request) {
        return ingestionService.recordManualScan(request);
    }

    /**
     * GET http://localhost:8080/api/attendance/12/calendar?start=2025-11-01&end=2025-11-30
     */
    @GetMapping("/{employeeId}/calendar")
    public List<DayContext> calendar(
            @PathVariable Long employeeId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end
    ) {
        return resolver.resolveRange(calendarLoader.load(employeeId, start, end));
    }
}
