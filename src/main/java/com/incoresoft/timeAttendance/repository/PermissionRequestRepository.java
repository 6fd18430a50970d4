package com.incoresoft.timeAttendance.repository;

import com.incoresoft.timeAttendance.domain.request.dto.PermissionRequest;
import com.incoresoft.timeAttendance.domain.request.dto.RequestStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface PermissionRequestRepository extends JpaRepository<PermissionRequest, Long> {

    /**
     * Requests in any of the given statuses whose time window intersects [from, to).
     */
    @Query("select p from PermissionRequest p where p.employeeId = :employeeId and p.status in :statuses " +
            "and p.startTime < :to and p.endTime > :from order by p.startTime asc")
    List<PermissionRequest> findOverlapping(@Param("employeeId") Long employeeId,
                                            @Param("statuses") Collection<RequestStatus> statuses,
                                            @Param("from") LocalDateTime from,
                                            @Param("to") LocalDateTime to);
}
