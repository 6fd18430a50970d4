package com.incoresoft.timeAttendance.domain.employee.dto;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;

import java.time.LocalDate;

/**
 * Employee directory row. Maintained by the HR side; this service only reads it.
 */
@Entity
@Table(name = "employees")
@Data
public class Employee {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "full_name")
    private String fullName;

    /** Identifier the terminal reports as user_id (the enrolled fingerprint number). */
    @Column(name = "biometric_id", unique = true)
    private String biometricId;

    /** Days before this date are never reconciled or counted as absent. */
    @Column(name = "joining_date")
    private LocalDate joiningDate;

    @Convert(converter = EmployeeStatus.DbConverter.class)
    @Column(name = "status")
    private EmployeeStatus status = EmployeeStatus.ACTIVE;

    public boolean hasJoinedBy(LocalDate date) {
        return joiningDate == null || !date.isBefore(joiningDate);
    }
}
