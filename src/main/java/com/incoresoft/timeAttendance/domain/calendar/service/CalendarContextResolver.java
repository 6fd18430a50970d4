package com.incoresoft.timeAttendance.domain.calendar.service;

import com.incoresoft.timeAttendance.config.AttendanceProps;
import com.incoresoft.timeAttendance.domain.attendance.dto.DailyAttendanceRecord;
import com.incoresoft.timeAttendance.domain.calendar.dto.DayClassification;
import com.incoresoft.timeAttendance.domain.calendar.dto.DayContext;
import com.incoresoft.timeAttendance.domain.calendar.dto.EmployeeCalendar;
import com.incoresoft.timeAttendance.domain.request.dto.LeaveRequest;
import com.incoresoft.timeAttendance.domain.request.dto.PaidHoliday;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Classifies a day for an employee. Precedence, first match wins:
 * <ol>
 *     <li>before joining date</li>
 *     <li>in the future</li>
 *     <li>paid holiday</li>
 *     <li>Friday or Saturday (day off, worked or not)</li>
 *     <li>approved leave, approved permission, attendance, otherwise absent</li>
 * </ol>
 */
@Component
@RequiredArgsConstructor
public class CalendarContextResolver {
    private final AttendanceProps props;
    private final Clock clock;

    public List<DayContext> resolveRange(EmployeeCalendar calendar) {
        return calendar.start().datesUntil(calendar.end().plusDays(1))
                .map(d -> resolve(calendar, d))
                .toList();
    }

    public DayContext resolve(EmployeeCalendar calendar, LocalDate date) {
        if (!calendar.employee().hasJoinedBy(date)) {
            return DayContext.of(date, DayClassification.NOT_YET_JOINED, "Not Yet Joined");
        }
        if (date.isAfter(LocalDate.now(clock))) {
            return DayContext.of(date, DayClassification.FUTURE_DATE, "");
        }

        DailyAttendanceRecord attendance = calendar.attendanceOn(date).orElse(null);

        Optional<PaidHoliday> holiday = calendar.holidayOn(date);
        if (holiday.isPresent()) {
            String description = holiday.get().getDescription() == null ? "Holiday" : holiday.get().getDescription();
            String label = attendance != null ? "Present - " + description : description;
            return withAttendance(date, DayClassification.HOLIDAY, label, attendance, null);
        }

        if (isWeekend(date)) {
            if (attendance == null) {
                return DayContext.of(date, DayClassification.DAY_OFF, "Day Off");
            }
            boolean permission = calendar.approvedPermissionOn(date).isPresent();
            Double extra = permission ? null : extraTime(attendance);
            return withAttendance(date, DayClassification.DAY_OFF_PRESENT, "Day Off - Present", attendance, extra);
        }

        Optional<LeaveRequest> leave = calendar.approvedLeaveOn(date);
        if (leave.isPresent()) {
            String type = leave.get().getLeaveType();
            String label = (type == null || type.isBlank()) ? "Leave" : type;
            return withAttendance(date, DayClassification.LEAVE, label, attendance, null);
        }
        if (calendar.approvedPermissionOn(date).isPresent()) {
            return withAttendance(date, DayClassification.PERMISSION, "Permission", attendance, null);
        }
        if (attendance != null) {
            return withAttendance(date, DayClassification.PRESENT, "Present", attendance, extraTime(attendance));
        }
        return DayContext.of(date, DayClassification.ABSENT, "Absent");
    }

    /** Friday and Saturday are the weekly days off. */
    public static boolean isWeekend(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return dow == DayOfWeek.FRIDAY || dow == DayOfWeek.SATURDAY;
    }

    /** Monday to Thursday; Sunday is neither a working day nor a day off. */
    public static boolean isWorkingDay(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return dow != DayOfWeek.SUNDAY && !isWeekend(date);
    }

    /**
     * Span between the first and last scan of the day, regardless of direction. A
     * single-scan day counts as a standard workday. Records written without scan bounds
     * fall back to first check-in and last check-out.
     */
    Double hoursWorked(DailyAttendanceRecord record) {
        if (record.isIncompleteDay()) {
            return props.getStandardWorkdayHours();
        }
        LocalDateTime from = record.getFirstScanAt() != null ? record.getFirstScanAt() : record.getFirstCheckIn();
        LocalDateTime to = record.getLastScanAt() != null ? record.getLastScanAt() : record.getLastCheckOut();
        if (from == null || to == null || !to.isAfter(from)) {
            return null;
        }
        return Duration.between(from, to).toSeconds() / 3600.0;
    }

    /** Hours beyond the standard workday, negative when short. Null when the day does not accrue. */
    private Double extraTime(DailyAttendanceRecord record) {
        if (record.isIncompleteDay()) return null;
        Double hours = hoursWorked(record);
        return hours == null ? null : hours - props.getStandardWorkdayHours();
    }

    private DayContext withAttendance(LocalDate date, DayClassification classification, String label,
                                      DailyAttendanceRecord attendance, Double extra) {
        if (attendance == null) {
            return DayContext.of(date, classification, label);
        }
        return new DayContext(date, classification, label,
                attendance.getFirstCheckIn(), attendance.getLastCheckOut(),
                hoursWorked(attendance), extra, attendance.isIncompleteDay());
    }
}
