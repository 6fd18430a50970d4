package com.incoresoft.timeAttendance.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Biometric terminal connectivity. The terminal address itself lives in the
 * {@code device_settings} table; these are the transport knobs.
 */
@Data
@ConfigurationProperties(prefix = "device")
public class DeviceProps {
    /** Bearer token sent to the terminal HTTP API. */
    private String token;
    private int connectTimeoutSeconds = 3;
    private int readTimeoutSeconds = 30;
    /** Connection attempts before the sync is declared a connection error. */
    private int connectAttempts = 3;
    private long backoffInitialMs = 1000;
    private double backoffMultiplier = 2.0;
    private long backoffMaxMs = 10000;
    /** Scans committed per transaction. */
    private int batchSize = 100;
    /** Records requested per page from the terminal. */
    private int pageLimit = 500;
    private boolean autoSync = true;
    private int syncIntervalMinutes = 5;
    /** Shared secret for signed pushes from the on-site sync agent. */
    private String agentSecret;
}
