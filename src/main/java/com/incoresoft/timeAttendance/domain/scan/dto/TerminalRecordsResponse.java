package com.incoresoft.timeAttendance.domain.scan.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TerminalRecordsResponse {
  @JsonProperty("data")
  private List<TerminalRecordDto> data;
  @JsonProperty("total")
  private Integer total;
}
