package com.incoresoft.timeAttendance.repository;

import com.incoresoft.timeAttendance.domain.request.dto.LeaveRequest;
import com.incoresoft.timeAttendance.domain.request.dto.RequestStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * Read-only view of the leave approval workflow.
 */
@Repository
public interface LeaveRequestRepository extends JpaRepository<LeaveRequest, Long> {

    /**
     * Requests in any of the given statuses that overlap [start, end].
     */
    @Query("select l from LeaveRequest l where l.employeeId = :employeeId and l.status in :statuses " +
            "and l.startDate <= :end and l.endDate >= :start order by l.startDate asc")
    List<LeaveRequest> findOverlapping(@Param("employeeId") Long employeeId,
                                       @Param("statuses") Collection<RequestStatus> statuses,
                                       @Param("start") LocalDate start,
                                       @Param("end") LocalDate end);
}
