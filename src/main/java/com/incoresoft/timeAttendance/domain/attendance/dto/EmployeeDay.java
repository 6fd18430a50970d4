package com.incoresoft.timeAttendance.domain.attendance.dto;

import java.time.LocalDate;

/**
 * Reconciliation key.
 */
public record EmployeeDay(Long employeeId, LocalDate date) {
}
