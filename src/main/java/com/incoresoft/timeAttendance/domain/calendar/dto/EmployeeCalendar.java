package com.incoresoft.timeAttendance.domain.calendar.dto;

import com.incoresoft.timeAttendance.domain.attendance.dto.DailyAttendanceRecord;
import com.incoresoft.timeAttendance.domain.employee.dto.Employee;
import com.incoresoft.timeAttendance.domain.request.dto.LeaveRequest;
import com.incoresoft.timeAttendance.domain.request.dto.PaidHoliday;
import com.incoresoft.timeAttendance.domain.request.dto.PermissionRequest;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything known about one employee over [start, end]: daily records keyed by date,
 * approved and pending requests overlapping the range, and company holidays.
 */
public record EmployeeCalendar(Employee employee,
                               LocalDate start,
                               LocalDate end,
                               Map<LocalDate, DailyAttendanceRecord> records,
                               List<LeaveRequest> leaves,
                               List<PermissionRequest> permissions,
                               List<PaidHoliday> holidays) {

    /** Record of the day, only when it holds at least one scan bound. */
    public Optional<DailyAttendanceRecord> attendanceOn(LocalDate date) {
        return Optional.ofNullable(records.get(date)).filter(DailyAttendanceRecord::hasAnyScanBound);
    }

    public Optional<PaidHoliday> holidayOn(LocalDate date) {
        return holidays.stream().filter(h -> h.covers(date)).findFirst();
    }

    public Optional<LeaveRequest> approvedLeaveOn(LocalDate date) {
        return leaves.stream().filter(LeaveRequest::isApproved).filter(l -> l.covers(date)).findFirst();
    }

    public Optional<PermissionRequest> approvedPermissionOn(LocalDate date) {
        return permissions.stream().filter(PermissionRequest::isApproved).filter(p -> p.covers(date)).findFirst();
    }
}
