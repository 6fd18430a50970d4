package com.incoresoft.timeAttendance.repository;

import com.incoresoft.timeAttendance.domain.sync.dto.SyncErrorKind;
import com.incoresoft.timeAttendance.domain.sync.dto.SyncFailureEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Append-only failure audit trail.
 */
@Repository
public interface SyncFailureEventRepository extends JpaRepository<SyncFailureEvent, Long> {

    List<SyncFailureEvent> findByCreatedAtBetweenOrderByCreatedAtDesc(LocalDateTime from, LocalDateTime to);

    List<SyncFailureEvent> findByCreatedAtBetweenAndResolvedOrderByCreatedAtDesc(LocalDateTime from, LocalDateTime to, boolean resolved);

    boolean existsByErrorKindAndDeviceAddressAndEmployeeIdAndResolvedFalse(SyncErrorKind errorKind, String deviceAddress, String employeeId);
}
