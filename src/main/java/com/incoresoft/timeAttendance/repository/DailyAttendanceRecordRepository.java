package com.incoresoft.timeAttendance.repository;

import com.incoresoft.timeAttendance.domain.attendance.dto.DailyAttendanceRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface DailyAttendanceRecordRepository extends JpaRepository<DailyAttendanceRecord, Long> {

    Optional<DailyAttendanceRecord> findByEmployeeIdAndDate(Long employeeId, LocalDate date);

    List<DailyAttendanceRecord> findByEmployeeIdAndDateBetweenOrderByDateAsc(Long employeeId, LocalDate start, LocalDate end);
}
