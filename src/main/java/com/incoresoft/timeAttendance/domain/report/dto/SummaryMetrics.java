package com.incoresoft.timeAttendance.domain.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Twelve-field summary of an employee over a date range. Every report surface renders
 * from this; none recomputes it.
 */
public record SummaryMetrics(
        @JsonProperty("total_days") int totalDays,
        @JsonProperty("total_working_days") int totalWorkingDays,
        @JsonProperty("present_days") int presentDays,
        @JsonProperty("absent_days") int absentDays,
        @JsonProperty("annual_leave_days") int annualLeaveDays,
        @JsonProperty("unpaid_leave_days") int unpaidLeaveDays,
        @JsonProperty("paid_leave_days") int paidLeaveDays,
        @JsonProperty("permission_hours") double permissionHours,
        @JsonProperty("day_off_days") int dayOffDays,
        @JsonProperty("incomplete_days") int incompleteDays,
        @JsonProperty("attendance_percentage") double attendancePercentage,
        @JsonProperty("extra_time_hours") double extraTimeHours) {
}
