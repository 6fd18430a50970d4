package com.incoresoft.timeAttendance.domain.report.service;

import com.incoresoft.timeAttendance.config.AttendanceProps;
import com.incoresoft.timeAttendance.domain.attendance.dto.AttendanceStatus;
import com.incoresoft.timeAttendance.domain.attendance.dto.DailyAttendanceRecord;
import com.incoresoft.timeAttendance.domain.calendar.dto.DayContext;
import com.incoresoft.timeAttendance.domain.calendar.dto.EmployeeCalendar;
import com.incoresoft.timeAttendance.domain.calendar.service.CalendarContextResolver;
import com.incoresoft.timeAttendance.domain.calendar.service.EmployeeCalendarLoader;
import com.incoresoft.timeAttendance.domain.request.dto.LeaveBucket;
import com.incoresoft.timeAttendance.domain.request.dto.LeaveRequest;
import com.incoresoft.timeAttendance.domain.request.dto.PermissionRequest;
import com.incoresoft.timeAttendance.domain.report.dto.EmployeeReport;
import com.incoresoft.timeAttendance.domain.report.dto.ReportBatch;
import com.incoresoft.timeAttendance.domain.report.dto.SummaryMetrics;
import com.incoresoft.timeAttendance.domain.sync.service.BackgroundSyncTrigger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rolls a date range up into {@link SummaryMetrics}. The per-day view comes from
 * {@link CalendarContextResolver}, so the day list and the totals always agree.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportAggregator {
    private final EmployeeCalendarLoader calendarLoader;
    private final CalendarContextResolver resolver;
    private final BackgroundSyncTrigger syncTrigger;
    private final AttendanceProps props;
    private final Clock clock;

    /**
     * @throws IllegalArgumentException start after end
     * @throws com.incoresoft.timeAttendance.domain.shared.NotFoundException unknown employee
     * @throws AggregationException     stored data could not be read
     */
    public EmployeeReport aggregate(Long employeeId, LocalDate start, LocalDate end) {
        requestSyncOnRead();
        return buildReport(employeeId, start, end);
    }

    /**
     * Best effort over several employees: a failing employee lands in the error list and
     * the others are still reported.
     */
    public ReportBatch aggregateAll(Collection<Long> employeeIds, LocalDate start, LocalDate end) {
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start must not be after end");
        }
        requestSyncOnRead();
        List<EmployeeReport> reports = new ArrayList<>();
        List<ReportBatch.ReportError> errors = new ArrayList<>();
        for (Long employeeId : employeeIds) {
            try {
                reports.add(buildReport(employeeId, start, end));
            } catch (Exception ex) {
                log.error("[REPORT] Failed to aggregate employee {}: {}", employeeId, ex.getMessage(), ex);
                errors.add(new ReportBatch.ReportError(employeeId, ex.getMessage()));
            }
        }
        return new ReportBatch(reports, errors);
    }

    private EmployeeReport buildReport(Long employeeId, LocalDate start, LocalDate end) {
        EmployeeCalendar calendar;
        try {
            calendar = calendarLoader.load(employeeId, start, end);
        } catch (DataAccessException ex) {
            throw new AggregationException("Failed to load attendance data for employee " + employeeId, ex);
        }
        List<DayContext> days = resolver.resolveRange(calendar);
        SummaryMetrics summary = summarize(calendar, days);
        log.debug("[REPORT] employee {} {}..{}: {}", employeeId, start, end, summary);
        return new EmployeeReport(employeeId, calendar.employee().getFullName(), start, end, summary, days);
    }

    SummaryMetrics summarize(EmployeeCalendar calendar, List<DayContext> days) {
        LocalDate start = calendar.start();
        LocalDate end = calendar.end();
        LocalDate today = LocalDate.now(clock);
        Collection<DailyAttendanceRecord> records = calendar.records().values();

        int totalDays = (int) ChronoUnit.DAYS.between(start, end) + 1;

        int presentDays = (int) records.stream()
                .filter(r -> r.hasAnyScanBound() || AttendanceStatus.WORKED.contains(r.getStatus()))
                .count();

        Map<LeaveBucket, Integer> leaveDays = leaveDaysByBucket(calendar.leaves(), start, end);
        int annualLeaveDays = leaveDays.get(LeaveBucket.ANNUAL);
        int unpaidLeaveDays = leaveDays.get(LeaveBucket.UNPAID);
        int paidLeaveDays = leaveDays.get(LeaveBucket.PAID);

        int dayOffCandidates = 0;
        int dayOffUsed = 0;
        int absentDays = 0;
        for (LocalDate date = start; !date.isAfter(end); date = date.plusDays(1)) {
            boolean holiday = calendar.holidayOn(date).isPresent();
            if (holiday && date.getDayOfWeek().getValue() <= 5) {
                paidLeaveDays++;
            }
            if (CalendarContextResolver.isWeekend(date)) {
                dayOffCandidates++;
                if (calendar.attendanceOn(date).isPresent() || calendar.approvedLeaveOn(date).isPresent() || holiday) {
                    dayOffUsed++;
                }
            } else if (CalendarContextResolver.isWorkingDay(date)
                    && calendar.employee().hasJoinedBy(date)
                    && !date.isAfter(today)
                    && !calendar.records().containsKey(date)
                    && calendar.approvedLeaveOn(date).isEmpty()
                    && !holiday
                    && calendar.approvedPermissionOn(date).isEmpty()) {
                absentDays++;
            }
        }
        int dayOffDays = Math.max(0, dayOffCandidates - dayOffUsed);

        double permissionHours = permissionHours(calendar.permissions(), start, end);

        int incompleteDays = (int) records.stream().filter(DailyAttendanceRecord::isIncompleteDay).count();

        double extraTime = days.stream()
                .map(DayContext::extraTimeHours)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .sum();

        int totalWorkingDays = dayOffDays + presentDays + annualLeaveDays + paidLeaveDays;
        double percentage = totalWorkingDays > 0 ? round(presentDays * 100.0 / totalWorkingDays, 1) : 0.0;

        return new SummaryMetrics(totalDays, totalWorkingDays, presentDays, absentDays,
                annualLeaveDays, unpaidLeaveDays, paidLeaveDays, permissionHours,
                dayOffDays, incompleteDays, percentage, round(extraTime, 1));
    }

    /** Leave days clipped to [start, end], by bucket. Approved and pending requests both count. */
    static Map<LeaveBucket, Integer> leaveDaysByBucket(List<LeaveRequest> leaves, LocalDate start, LocalDate end) {
        Map<LeaveBucket, Integer> buckets = new EnumMap<>(LeaveBucket.class);
        for (LeaveBucket bucket : LeaveBucket.values()) {
            buckets.put(bucket, 0);
        }
        for (LeaveRequest leave : leaves) {
            LocalDate from = leave.getStartDate().isAfter(start) ? leave.getStartDate() : start;
            LocalDate to = leave.getEndDate().isBefore(end) ? leave.getEndDate() : end;
            if (from.isAfter(to)) continue;
            int days = (int) ChronoUnit.DAYS.between(from, to) + 1;
            buckets.merge(LeaveBucket.of(leave.getLeaveType()), days, Integer::sum);
        }
        return buckets;
    }

    /** Hours of each permission inside [start 00:00, end + 1 day 00:00), rounded to 2 decimals. */
    static double permissionHours(List<PermissionRequest> permissions, LocalDate start, LocalDate end) {
        LocalDateTime rangeStart = start.atStartOfDay();
        LocalDateTime rangeEnd = end.plusDays(1).atStartOfDay();
        double hours = 0;
        for (PermissionRequest p : permissions) {
            LocalDateTime from = p.getStartTime().isAfter(rangeStart) ? p.getStartTime() : rangeStart;
            LocalDateTime to = p.getEndTime().isBefore(rangeEnd) ? p.getEndTime() : rangeEnd;
            if (to.isAfter(from)) {
                hours += Duration.between(from, to).toSeconds() / 3600.0;
            }
        }
        return round(hours, 2);
    }

    private void requestSyncOnRead() {
        if (props.isSyncOnRead()) {
            syncTrigger.requestBackgroundSync();
        }
    }

    private static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
