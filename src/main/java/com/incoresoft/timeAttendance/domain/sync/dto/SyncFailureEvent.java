package com.incoresoft.timeAttendance.domain.sync.dto;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Audit row for a device or reconciliation failure. Only the resolution fields are
 * updated after insert.
 */
@Entity
@Table(name = "sync_failure_events", indexes = @Index(name = "ix_sync_failure_created", columnList = "created_at"))
@Data
public class SyncFailureEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_kind", nullable = false, length = 32)
    private SyncErrorKind errorKind;

    @Column(name = "message", length = 1000)
    private String message;

    @Column(name = "device_address")
    private String deviceAddress;

    /** Identifier as seen on the device (biometric id) or the employee id for reconciliation errors. */
    @Column(name = "employee_id")
    private String employeeId;

    @Column(name = "raw_payload", columnDefinition = "text")
    private String rawPayload;

    @Column(name = "resolved", nullable = false)
    private boolean resolved;

    @Column(name = "resolution_note")
    private String resolutionNote;

    /** Resolved by entering the missing scan by hand. */
    @Column(name = "manual_entry", nullable = false)
    private boolean manualEntry;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
