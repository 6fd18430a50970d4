package com.incoresoft.timeAttendance.domain.sync.dto;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Configured biometric terminal. Sync runs against the first active row.
 */
@Entity
@Table(name = "device_settings")
@Data
public class DeviceSettings {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "device_name")
    private String deviceName;

    /** Base URL of the terminal API, e.g. http://192.168.11.253:4370 */
    @Column(name = "device_address", nullable = false)
    private String deviceAddress;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    /** Newest scan time already fetched; the next sync asks only for later records. */
    @Column(name = "last_sync_at")
    private LocalDateTime lastSyncAt;
}
