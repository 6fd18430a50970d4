package com.incoresoft.timeAttendance.domain.scan.service;

import com.incoresoft.timeAttendance.domain.scan.dto.ScanDirection;

import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Time-of-day heuristic for scans that carry no direction of their own.
 * 04:00 up to (not including) 14:00 is a check-in; everything else is a check-out.
 */
public final class ScanClassifier {
    private static final LocalTime CHECK_IN_FROM = LocalTime.of(4, 0);
    private static final LocalTime CHECK_OUT_FROM = LocalTime.of(14, 0);

    private ScanClassifier() {
    }

    public static ScanDirection classify(LocalDateTime timestamp) {
        LocalTime time = timestamp.toLocalTime();
        boolean morning = !time.isBefore(CHECK_IN_FROM) && time.isBefore(CHECK_OUT_FROM);
        return morning ? ScanDirection.CHECK_IN : ScanDirection.CHECK_OUT;
    }

    /** Terminal punch code, or null when the device did not report one. */
    public static ScanDirection fromPunch(Integer punch) {
        if (punch == null) return null;
        return punch == 0 ? ScanDirection.CHECK_IN : ScanDirection.CHECK_OUT;
    }

    /** Keeps a direction that is already known, otherwise falls back to {@link #classify}. */
    public static ScanDirection resolve(ScanDirection known, LocalDateTime timestamp) {
        return known != null ? known : classify(timestamp);
    }
}
