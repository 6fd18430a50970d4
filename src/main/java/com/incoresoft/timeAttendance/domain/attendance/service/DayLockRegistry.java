package com.incoresoft.timeAttendance.domain.attendance.service;

import com.incoresoft.timeAttendance.domain.attendance.dto.EmployeeDay;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Striped in-process locks serializing writers of the same (employee, date).
 * Different days may share a stripe; that only costs some parallelism.
 */
@Component
public class DayLockRegistry {
    private static final int STRIPES = 64;

    private final Lock[] stripes = new Lock[STRIPES];

    public DayLockRegistry() {
        for (int i = 0; i < STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public Lock lockFor(EmployeeDay day) {
        return stripes[Math.floorMod(day.hashCode(), STRIPES)];
    }
}
