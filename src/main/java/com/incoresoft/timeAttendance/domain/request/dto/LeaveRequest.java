package com.incoresoft.timeAttendance.domain.request.dto;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;

import java.time.LocalDate;

@Entity
@Table(name = "leave_requests")
@Data
public class LeaveRequest {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "employee_id", nullable = false)
    private Long employeeId;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    /** Free-form leave type name ("Annual Leave", "Sick", "Unpaid", ...). */
    @Column(name = "leave_type")
    private String leaveType;

    @Convert(converter = RequestStatus.DbConverter.class)
    @Column(name = "status", nullable = false)
    private RequestStatus status;

    @Column(name = "reason")
    private String reason;

    public boolean covers(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    public boolean isApproved() {
        return status == RequestStatus.APPROVED;
    }
}
