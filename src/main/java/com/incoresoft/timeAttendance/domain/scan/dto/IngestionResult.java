package com.incoresoft.timeAttendance.domain.scan.dto;

import com.incoresoft.timeAttendance.domain.attendance.dto.EmployeeDay;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * What one ingestion pass did with a set of terminal records.
 */
@Data
public class IngestionResult {
    private int recordsAdded;
    /** Already stored, or repeated within the same fetch. */
    private int duplicates;
    /** Records whose device id matches no employee. */
    private int unmatched;
    private int malformed;
    /** Days that received at least one new scan. */
    private Set<EmployeeDay> touchedDays = new LinkedHashSet<>();
    /** Newest timestamp among the fetched records, committed or not. */
    private LocalDateTime newestTimestamp;
    private List<String> errors = new ArrayList<>();

    public void seen(LocalDateTime timestamp) {
        if (newestTimestamp == null || timestamp.isAfter(newestTimestamp)) {
            newestTimestamp = timestamp;
        }
    }
}
