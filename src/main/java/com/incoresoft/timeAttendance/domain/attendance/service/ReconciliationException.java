package com.incoresoft.timeAttendance.domain.attendance.service;

import java.time.LocalDate;

/**
 * Reconciliation of a single (employee, date) failed. Its transaction was rolled back.
 */
public class ReconciliationException extends RuntimeException {
    public ReconciliationException(Long employeeId, LocalDate date, Throwable cause) {
        super("Reconciliation failed for employee " + employeeId + " on " + date + ": " + cause.getMessage(), cause);
    }
}
