package com.incoresoft.timeAttendance.domain.scan.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Attendance record as reported by the terminal or pushed by the sync agent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TerminalRecordDto {
    /** Enrolled fingerprint number on the device. */
    @JsonProperty("user_id")
    private String userId;
    @JsonProperty("timestamp")
    private LocalDateTime timestamp;
    /** 0 = check-in, anything else = check-out; absent when the device does not track it. */
    @JsonProperty("punch")
    private Integer punch;
}
