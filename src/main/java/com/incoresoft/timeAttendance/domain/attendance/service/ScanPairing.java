package com.incoresoft.timeAttendance.domain.attendance.service;

import com.incoresoft.timeAttendance.domain.scan.dto.ScanDirection;
import com.incoresoft.timeAttendance.domain.scan.dto.ScanEvent;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Result of walking a day's scans in time order.
 *
 * A check-in opens an interval when none is open; the next check-out closes it.
 * A second check-in while open and a check-out with nothing open do not affect pairing,
 * but still count toward the first/last bounds.
 */
record ScanPairing(LocalDateTime firstCheckIn,
                   LocalDateTime lastCheckOut,
                   long workedMinutes,
                   int pairCount,
                   boolean activeCheckIn) {

    /** Scans must be sorted ascending and already carry a direction. */
    static ScanPairing of(List<ScanEvent> scans) {
        LocalDateTime firstIn = null;
        LocalDateTime lastOut = null;
        LocalDateTime open = null;
        long minutes = 0;
        int pairs = 0;
        for (ScanEvent scan : scans) {
            LocalDateTime ts = scan.getTimestamp();
            if (scan.getDirection() == ScanDirection.CHECK_IN) {
                if (firstIn == null) firstIn = ts;
                if (open == null) open = ts;
            } else {
                lastOut = ts;
                if (open != null) {
                    minutes += Duration.between(open, ts).toMinutes();
                    pairs++;
                    open = null;
                }
            }
        }
        return new ScanPairing(firstIn, lastOut, minutes, pairs, open != null);
    }
}
