package com.incoresoft.timeAttendance.domain.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Reports for several employees. Employees whose aggregation failed are listed in
 * {@code errors} instead of failing the whole batch.
 */
public record ReportBatch(
        @JsonProperty("reports") List<EmployeeReport> reports,
        @JsonProperty("errors") List<ReportError> errors) {

    public record ReportError(@JsonProperty("employee_id") Long employeeId,
                              @JsonProperty("message") String message) {
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
