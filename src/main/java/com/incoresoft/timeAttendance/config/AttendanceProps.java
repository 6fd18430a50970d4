package com.incoresoft.timeAttendance.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Attendance rules. Read from the {@code attendance} block of application.yml.
 */
@Data
@ConfigurationProperties(prefix = "attendance")
public class AttendanceProps {
    /**
     * Zone that defines "today" and the calendar day of a scan.
     */
    private String timezone = "Asia/Kolkata";
    /**
     * Worked hours at or above which a closed day is {@code present}.
     */
    private double fullDayHours = 9.0;
    /**
     * Worked hours at or above which a closed day is {@code half-day}; below it is {@code partial}.
     */
    private double halfDayHours = 4.0;
    /**
     * Standard workday used for extra time and for single-scan days.
     */
    private double standardWorkdayHours = 9.0;
    /**
     * Kick a background device sync whenever a report is read.
     */
    private boolean syncOnRead = true;
}
