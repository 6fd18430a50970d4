package com.incoresoft.timeAttendance.web;

import com.incoresoft.timeAttendance.domain.report.dto.EmployeeReport;
import com.incoresoft.timeAttendance.domain.report.dto.ReportBatch;
import com.incoresoft.timeAttendance.domain.report.service.ReportAggregator;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
public class ReportController {
    private final ReportAggregator aggregator;

    /**
     * GET http://localhost:8080/api/reports/12/summary?start=2025-11-01&end=2025-11-30
     */
    @GetMapping("/{employeeId}/summary")
    public EmployeeReport summary(
            @PathVariable Long employeeId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end
    ) {
        return aggregator.aggregate(employeeId, start, end);
    }

    /**
     * GET http://localhost:8080/api/reports/summary?employeeIds=12,14,20&start=2025-11-01&end=2025-11-30
     * Employees that fail to aggregate are reported under "errors"; the rest still render.
     */
    @GetMapping("/summary")
    public ReportBatch summaries(
            @RequestParam(name = "employeeIds") String employeeIds,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end
    ) {
        return aggregator.aggregateAll(parseIds(employeeIds), start, end);
    }

    static List<Long> parseIds(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("employeeIds must not be empty");
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(Long::valueOf)
                .distinct()
                .collect(Collectors.toList());
    }
}
