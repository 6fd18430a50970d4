package com.incoresoft.timeAttendance.domain.attendance.dto;

import lombok.Data;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome counts of a multi-day reconciliation. Failed pairs are listed, never fatal.
 */
@Data
public class BatchReconciliationResult {
    private int reconciled;
    private int noRecord;
    private int notApplicable;
    private List<Failure> failures = new ArrayList<>();

    public record Failure(Long employeeId, LocalDate date, String message) {
    }

    public void count(ReconciliationResult result) {
        switch (result.outcome()) {
            case RECONCILED -> reconciled++;
            case NO_RECORD -> noRecord++;
            case NOT_APPLICABLE -> notApplicable++;
        }
    }

    public void fail(EmployeeDay day, String message) {
        failures.add(new Failure(day.employeeId(), day.date(), message));
    }
}
