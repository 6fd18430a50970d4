package com.incoresoft.timeAttendance.domain.calendar.service;

import com.incoresoft.timeAttendance.domain.attendance.dto.DailyAttendanceRecord;
import com.incoresoft.timeAttendance.domain.calendar.dto.EmployeeCalendar;
import com.incoresoft.timeAttendance.domain.employee.dto.Employee;
import com.incoresoft.timeAttendance.domain.request.dto.RequestStatus;
import com.incoresoft.timeAttendance.domain.shared.NotFoundException;
import com.incoresoft.timeAttendance.repository.DailyAttendanceRecordRepository;
import com.incoresoft.timeAttendance.repository.EmployeeRepository;
import com.incoresoft.timeAttendance.repository.LeaveRequestRepository;
import com.incoresoft.timeAttendance.repository.PaidHolidayRepository;
import com.incoresoft.timeAttendance.repository.PermissionRequestRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reads the records, requests and holidays the resolver and the aggregator work from.
 */
@Component
@RequiredArgsConstructor
public class EmployeeCalendarLoader {
    private final EmployeeRepository employeeRepository;
    private final DailyAttendanceRecordRepository recordRepository;
    private final LeaveRequestRepository leaveRequestRepository;
    private final PermissionRequestRepository permissionRequestRepository;
    private final PaidHolidayRepository paidHolidayRepository;

    @Transactional(readOnly = true)
    public EmployeeCalendar load(Long employeeId, LocalDate start, LocalDate end) {
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start must not be after end");
        }
        Employee employee = employeeRepository.findById(employeeId)
                .orElseThrow(() -> NotFoundException.employee(employeeId));

        Map<LocalDate, DailyAttendanceRecord> records = recordRepository
                .findByEmployeeIdAndDateBetweenOrderByDateAsc(employeeId, start, end).stream()
                .collect(Collectors.toMap(DailyAttendanceRecord::getDate, Function.identity(), (a, b) -> a, TreeMap::new));

        return new EmployeeCalendar(
                employee,
                start,
                end,
                records,
                leaveRequestRepository.findOverlapping(employeeId, RequestStatus.OPEN_OR_APPROVED, start, end),
                permissionRequestRepository.findOverlapping(employeeId, RequestStatus.OPEN_OR_APPROVED,
                        start.atStartOfDay(), end.plusDays(1).atStartOfDay()),
                paidHolidayRepository.findOverlapping(start, end));
    }
}
