package com.incoresoft.timeAttendance.domain.attendance.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDate;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReconciliationResult(Long employeeId, LocalDate date, Outcome outcome, DailyAttendanceRecord record) {

    public enum Outcome {
        /** Record written. */
        RECONCILED,
        /** No scans that day; nothing written. */
        NO_RECORD,
        /** Date is before the employee joined; nothing written. */
        NOT_APPLICABLE
    }

    public static ReconciliationResult reconciled(DailyAttendanceRecord record) {
        return new ReconciliationResult(record.getEmployeeId(), record.getDate(), Outcome.RECONCILED, record);
    }

    public static ReconciliationResult noRecord(Long employeeId, LocalDate date) {
        return new ReconciliationResult(employeeId, date, Outcome.NO_RECORD, null);
    }

    public static ReconciliationResult notApplicable(Long employeeId, LocalDate date) {
        return new ReconciliationResult(employeeId, date, Outcome.NOT_APPLICABLE, null);
    }
}
