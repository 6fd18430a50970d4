package com.incoresoft.timeAttendance.repository;

import com.incoresoft.timeAttendance.domain.request.dto.PaidHoliday;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface PaidHolidayRepository extends JpaRepository<PaidHoliday, Long> {

    /** Holidays overlapping [start, end]. A single-day holiday ends on its start date. */
    @Query("select h from PaidHoliday h where h.startDate <= :end and coalesce(h.endDate, h.startDate) >= :start order by h.startDate asc")
    List<PaidHoliday> findOverlapping(@Param("start") LocalDate start, @Param("end") LocalDate end);
}
