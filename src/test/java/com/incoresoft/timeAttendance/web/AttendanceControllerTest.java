package com.incoresoft.timeAttendance.web;

import com.incoresoft.timeAttendance.domain.attendance.dto.ReconciliationResult;
import com.incoresoft.timeAttendance.domain.attendance.service.DailyReconciler;
import com.incoresoft.timeAttendance.domain.attendance.service.ReconciliationException;
import com.incoresoft.timeAttendance.domain.calendar.service.CalendarContextResolver;
import com.incoresoft.timeAttendance.domain.calendar.service.EmployeeCalendarLoader;
import com.incoresoft.timeAttendance.domain.report.dto.ReportBatch;
import com.incoresoft.timeAttendance.domain.report.service.AggregationException;
import com.incoresoft.timeAttendance.domain.report.service.ReportAggregator;
import com.incoresoft.timeAttendance.domain.scan.service.DuplicateScanException;
import com.incoresoft.timeAttendance.domain.scan.service.ScanIngestionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AttendanceControllerTest {
    private static final LocalDate MONDAY = LocalDate.of(2025, 1, 13);

    private DailyReconciler reconciler;
    private ScanIngestionService ingestionService;
    private ReportAggregator aggregator;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        reconciler = mock(DailyReconciler.class);
        ingestionService = mock(ScanIngestionService.class);
        aggregator = mock(ReportAggregator.class);
        AttendanceController attendance = new AttendanceController(reconciler, ingestionService,
                mock(EmployeeCalendarLoader.class), mock(CalendarContextResolver.class));
        mvc = MockMvcBuilders.standaloneSetup(attendance, new ReportController(aggregator))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void reconcileReturnsOutcome() throws Exception {
        when(reconciler.reconcileDay(1L, MONDAY)).thenReturn(ReconciliationResult.noRecord(1L, MONDAY));

        mvc.perform(post("/api/attendance/1/reconcile").param("date", "2025-01-13"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("NO_RECORD"));
    }

    @Test
    void reconciliationFailureIsServerError() throws Exception {
        when(reconciler.reconcileDay(1L, MONDAY))
                .thenThrow(new ReconciliationException(1L, MONDAY, new IllegalStateException("db down")));

        mvc.perform(post("/api/attendance/1/reconcile").param("date", "2025-01-13"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("reconciliation_error"));
    }

    @Test
    void malformedDateIsBadRequest() throws Exception {
        mvc.perform(post("/api/attendance/1/reconcile").param("date", "13/01/2025"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("bad_request"));
    }

    @Test
    void manualEntryWithoutReasonIsValidationError() throws Exception {
        mvc.perform(post("/api/attendance/manual-entry")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"employee_id\":1,\"timestamp\":\"2025-01-13T09:00:00\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_error"));

        verifyNoInteractions(ingestionService);
    }

    @Test
    void duplicateManualEntryIsConflict() throws Exception {
        when(ingestionService.recordManualScan(any()))
                .thenThrow(new DuplicateScanException(1L, LocalDateTime.of(2025, 1, 13, 9, 0)));

        mvc.perform(post("/api/attendance/manual-entry")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"employee_id\":1,\"timestamp\":\"2025-01-13T09:00:00\",\"reason\":\"Forgot card\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("duplicate_scan"));
    }

    @Test
    void manualEntryIsCreated() throws Exception {
        when(ingestionService.recordManualScan(any())).thenReturn(ReconciliationResult.noRecord(1L, MONDAY));

        mvc.perform(post("/api/attendance/manual-entry")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"employee_id\":1,\"timestamp\":\"2025-01-13T09:00:00\",\"reason\":\"Forgot card\",\"direction\":\"check-in\"}"))
                .andExpect(status().isCreated());
    }

    @Test
    void multiEmployeeSummaryParsesIds() throws Exception {
        when(aggregator.aggregateAll(any(), any(), any())).thenReturn(new ReportBatch(List.of(), List.of()));

        mvc.perform(get("/api/reports/summary")
                        .param("employeeIds", "1, 2,2")
                        .param("start", "2025-01-01")
                        .param("end", "2025-01-31"))
                .andExpect(status().isOk());

        verify(aggregator).aggregateAll(eq(List.of(1L, 2L)), eq(LocalDate.of(2025, 1, 1)), eq(LocalDate.of(2025, 1, 31)));
    }

    @Test
    void aggregationFailureIsServerError() throws Exception {
        when(aggregator.aggregate(1L, MONDAY, MONDAY)).thenThrow(new AggregationException("db down", null));

        mvc.perform(get("/api/reports/1/summary").param("start", "2025-01-13").param("end", "2025-01-13"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("aggregation_error"));
    }

    @Test
    void invertedRangeIsBadRequest() throws Exception {
        when(aggregator.aggregate(eq(1L), any(), any())).thenThrow(new IllegalArgumentException("start must not be after end"));

        mvc.perform(get("/api/reports/1/summary").param("start", "2025-01-31").param("end", "2025-01-01"))
                .andExpect(status().isBadRequest());
    }
}
