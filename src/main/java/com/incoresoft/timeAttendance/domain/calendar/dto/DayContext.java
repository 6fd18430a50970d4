package com.incoresoft.timeAttendance.domain.calendar.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Resolved view of one day. {@code extraTimeHours} is null when the day accrues no extra
 * time and may be negative when fewer than the standard hours were worked.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DayContext(
        @JsonProperty("date") LocalDate date,
        @JsonProperty("classification") DayClassification classification,
        @JsonProperty("label") String label,
        @JsonProperty("check_in") LocalDateTime checkIn,
        @JsonProperty("check_out") LocalDateTime checkOut,
        @JsonProperty("hours_worked") Double hoursWorked,
        @JsonProperty("extra_time_hours") Double extraTimeHours,
        @JsonProperty("incomplete") boolean incomplete) {

    public static DayContext of(LocalDate date, DayClassification classification, String label) {
        return new DayContext(date, classification, label, null, null, null, null, false);
    }

    public boolean accruesExtraTime() {
        return extraTimeHours != null;
    }
}
