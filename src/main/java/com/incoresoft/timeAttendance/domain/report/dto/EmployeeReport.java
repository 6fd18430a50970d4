package com.incoresoft.timeAttendance.domain.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.incoresoft.timeAttendance.domain.calendar.dto.DayContext;

import java.time.LocalDate;
import java.util.List;

public record EmployeeReport(
        @JsonProperty("employee_id") Long employeeId,
        @JsonProperty("employee_name") String employeeName,
        @JsonProperty("start_date") LocalDate startDate,
        @JsonProperty("end_date") LocalDate endDate,
        @JsonProperty("summary") SummaryMetrics summary,
        @JsonProperty("days") List<DayContext> days) {
}
