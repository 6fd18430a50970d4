package com.incoresoft.timeAttendance.domain.request.dto;

import java.util.Locale;

/**
 * Summary bucket a leave type name falls into.
 */
public enum LeaveBucket {
    ANNUAL,
    UNPAID,
    PAID;

    public static LeaveBucket of(String leaveType) {
        if (leaveType == null || leaveType.isBlank()) return ANNUAL;
        String name = leaveType.toLowerCase(Locale.ROOT);
        if (name.contains("annual") || name.contains("vacation") || name.contains("sick") || name.contains("illness")) {
            return ANNUAL;
        }
        // "unpaid" must be checked before "paid"
        if (name.contains("unpaid")) return UNPAID;
        if (name.contains("paid") || name.contains("holiday")) return PAID;
        return ANNUAL;
    }
}
