package com.incoresoft.timeAttendance.domain.sync.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SyncStatus {
    SUCCESS,
    ERROR,
    ALREADY_RUNNING;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
