package com.incoresoft.timeAttendance.repository;

import com.incoresoft.timeAttendance.domain.sync.dto.DeviceSettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface DeviceSettingsRepository extends JpaRepository<DeviceSettings, Long> {

    Optional<DeviceSettings> findFirstByActiveTrueOrderByIdAsc();
}
