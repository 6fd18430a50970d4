package com.incoresoft.timeAttendance.domain.shared;

public class NotFoundException extends RuntimeException {
    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException employee(Long employeeId) {
        return new NotFoundException("Employee " + employeeId + " not found");
    }
}
