package com.incoresoft.timeAttendance.domain.scan.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Scan entered by an administrator, usually to close a failure the terminal produced.
 */
@Data
public class ManualScanRequest {
    @NotNull
    @JsonProperty("employee_id")
    private Long employeeId;
    @NotNull
    @JsonProperty("timestamp")
    private LocalDateTime timestamp;
    /** Optional; classified by time of day when omitted. */
    @JsonProperty("direction")
    private ScanDirection direction;
    @NotBlank
    @JsonProperty("reason")
    private String reason;
    /** Failure event this entry resolves, if any. */
    @JsonProperty("failure_id")
    private Long failureId;
}
