package com.incoresoft.timeAttendance.domain.sync.dto;

public enum SyncErrorKind {
    /** No active device configured. */
    CONFIG_ERROR,
    /** Terminal unreachable after all attempts. */
    CONNECTION_ERROR,
    /** Device identifier with no matching employee. */
    UNMATCHED_EMPLOYEE,
    /** Unexpected failure while fetching or persisting. */
    SYNC_ERROR,
    /** One (employee, date) could not be reconciled. */
    RECONCILIATION_ERROR;

    /** Kinds that page an administrator. Unmatched ids are only recorded. */
    public boolean notifiesAdmins() {
        return this != UNMATCHED_EMPLOYEE;
    }
}
