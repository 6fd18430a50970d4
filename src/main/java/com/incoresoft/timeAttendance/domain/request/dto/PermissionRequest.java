package com.incoresoft.timeAttendance.domain.request.dto;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Time-bounded absence during working hours.
 */
@Entity
@Table(name = "permission_requests")
@Data
public class PermissionRequest {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "employee_id", nullable = false)
    private Long employeeId;

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalDateTime endTime;

    @Convert(converter = RequestStatus.DbConverter.class)
    @Column(name = "status", nullable = false)
    private RequestStatus status;

    @Column(name = "reason")
    private String reason;

    /** A permission covers every calendar day from its start date to its end date. */
    public boolean covers(LocalDate date) {
        return !date.isBefore(startTime.toLocalDate()) && !date.isAfter(endTime.toLocalDate());
    }

    public boolean isApproved() {
        return status == RequestStatus.APPROVED;
    }

    public double durationHours() {
        return Duration.between(startTime, endTime).toSeconds() / 3600.0;
    }
}
