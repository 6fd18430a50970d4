package com.incoresoft.timeAttendance.domain.sync.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SyncResult {
    @JsonProperty("status")
    SyncStatus status;
    @JsonProperty("message")
    String message;
    @JsonProperty("records_added")
    int recordsAdded;
    @JsonProperty("duplicates")
    int duplicates;
    @JsonProperty("unmatched")
    int unmatched;
    @JsonProperty("days_reconciled")
    int daysReconciled;
    @Singular
    @JsonProperty("errors")
    List<String> errors;

    public static SyncResult alreadyRunning() {
        return SyncResult.builder()
                .status(SyncStatus.ALREADY_RUNNING)
                .message("Sync already in progress")
                .build();
    }

    public static SyncResult error(String message) {
        return SyncResult.builder()
                .status(SyncStatus.ERROR)
                .message(message)
                .error(message)
                .build();
    }
}
