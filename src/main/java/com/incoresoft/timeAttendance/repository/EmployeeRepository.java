package com.incoresoft.timeAttendance.repository;

import com.incoresoft.timeAttendance.domain.employee.dto.Employee;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface EmployeeRepository extends JpaRepository<Employee, Long> {

    /** Cache fill for a sync batch: one query for every biometric id seen on the device. */
    List<Employee> findByBiometricIdIn(Collection<String> biometricIds);
}
