package com.incoresoft.timeAttendance.domain.scan.service;

import java.time.LocalDateTime;

public class DuplicateScanException extends RuntimeException {
    public DuplicateScanException(Long employeeId, LocalDateTime timestamp) {
        super("Scan already recorded for employee " + employeeId + " at " + timestamp);
    }

    public DuplicateScanException(Long employeeId, LocalDateTime timestamp, Throwable cause) {
        super("Scan already recorded for employee " + employeeId + " at " + timestamp, cause);
    }
}
