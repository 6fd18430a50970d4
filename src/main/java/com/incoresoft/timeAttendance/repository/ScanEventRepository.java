package com.incoresoft.timeAttendance.repository;

import com.incoresoft.timeAttendance.domain.scan.dto.ScanEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Raw scans. Written by ingestion, re-annotated by the reconciler.
 */
@Repository
public interface ScanEventRepository extends JpaRepository<ScanEvent, Long> {

    /**
     * Scans of one employee in [from, to), oldest first.
     */
    @Query("select s from ScanEvent s where s.employeeId = :employeeId and s.timestamp >= :from and s.timestamp < :to order by s.timestamp asc, s.id asc")
    List<ScanEvent> findForDay(@Param("employeeId") Long employeeId,
                               @Param("from") LocalDateTime from,
                               @Param("to") LocalDateTime to);

    /**
     * Superset lookup for deduplication: every stored scan whose employee and timestamp
     * both appear in the given sets. Callers filter down to exact pairs.
     */
    List<ScanEvent> findByEmployeeIdInAndTimestampIn(Collection<Long> employeeIds, Collection<LocalDateTime> timestamps);

    boolean existsByEmployeeIdAndTimestamp(Long employeeId, LocalDateTime timestamp);
}
