package com.incoresoft.timeAttendance.domain.sync.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.incoresoft.timeAttendance.domain.scan.dto.TerminalRecordDto;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Body pushed by the on-site sync agent.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentSyncRequest {
    @JsonProperty("device_id")
    private String deviceId;
    @JsonProperty("logs")
    private List<TerminalRecordDto> logs = new ArrayList<>();
}
