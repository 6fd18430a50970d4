package com.incoresoft.timeAttendance.domain.sync.dto;

/**
 * IDLE -> CONNECTING -> SYNCING -> COMMITTING -> IDLE, FAILED from any of them.
 */
public enum SyncState {
    IDLE,
    CONNECTING,
    SYNCING,
    COMMITTING,
    FAILED
}
