package com.incoresoft.timeAttendance.domain.attendance.dto;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Canonical attendance for one employee on one calendar day.
 */
@Entity
@Table(name = "daily_attendance",
        uniqueConstraints = @UniqueConstraint(name = "uq_daily_employee_date", columnNames = {"employee_id", "attendance_date"}))
@Data
@NoArgsConstructor
public class DailyAttendanceRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "employee_id", nullable = false)
    private Long employeeId;

    @Column(name = "attendance_date", nullable = false)
    private LocalDate date;

    @Column(name = "first_check_in")
    private LocalDateTime firstCheckIn;

    @Column(name = "last_check_out")
    private LocalDateTime lastCheckOut;

    /** Earliest scan of the day, whatever its direction. */
    @Column(name = "first_scan_at")
    private LocalDateTime firstScanAt;

    @Column(name = "last_scan_at")
    private LocalDateTime lastScanAt;

    /** Sum of closed check-in/check-out intervals. */
    @Column(name = "total_worked_minutes", nullable = false)
    private long totalWorkedMinutes;

    /** Number of closed intervals. */
    @Column(name = "entry_pair_count", nullable = false)
    private int entryPairCount;

    @Convert(converter = AttendanceStatus.DbConverter.class)
    @Column(name = "status", nullable = false)
    private AttendanceStatus status = AttendanceStatus.ABSENT;

    @Column(name = "status_reason")
    private String statusReason;

    /** Exactly one scan that day. */
    @Column(name = "is_incomplete_day", nullable = false)
    private boolean incompleteDay;

    public DailyAttendanceRecord(Long employeeId, LocalDate date) {
        this.employeeId = employeeId;
        this.date = date;
    }

    public boolean hasAnyScanBound() {
        return firstCheckIn != null || lastCheckOut != null || firstScanAt != null;
    }
}
