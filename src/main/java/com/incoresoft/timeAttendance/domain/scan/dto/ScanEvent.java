package com.incoresoft.timeAttendance.domain.scan.dto;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * One raw terminal reading. Only the derived fields (sequence, extra flag, direction)
 * change after the row is written, and only during reconciliation.
 */
@Entity
@Table(name = "scan_events",
        uniqueConstraints = @UniqueConstraint(name = "uq_scan_employee_ts", columnNames = {"employee_id", "scan_time"}),
        indexes = @Index(name = "ix_scan_time", columnList = "scan_time"))
@Data
public class ScanEvent {
    /** Device address recorded for scans entered by an administrator. */
    public static final String MANUAL_DEVICE = "MANUAL";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "employee_id", nullable = false)
    private Long employeeId;

    /** Wall-clock time in the attendance time zone. */
    @Column(name = "scan_time", nullable = false)
    private LocalDateTime timestamp;

    @Convert(converter = ScanDirection.DbConverter.class)
    @Column(name = "direction")
    private ScanDirection direction;

    @Column(name = "device_address")
    private String deviceAddress;

    @Column(name = "is_manual", nullable = false)
    private boolean manual;

    @Column(name = "manual_reason")
    private String manualReason;

    @Column(name = "sequence_index")
    private Integer sequenceIndex;

    @Column(name = "is_extra_scan", nullable = false)
    private boolean extraScan;

    public static ScanEvent of(Long employeeId, LocalDateTime timestamp, ScanDirection direction, String deviceAddress) {
        ScanEvent scan = new ScanEvent();
        scan.setEmployeeId(employeeId);
        scan.setTimestamp(timestamp);
        scan.setDirection(direction);
        scan.setDeviceAddress(deviceAddress);
        return scan;
    }
}
