package com.incoresoft.timeAttendance.domain.employee.dto;

import com.incoresoft.timeAttendance.domain.shared.CodedEnum;
import com.incoresoft.timeAttendance.domain.shared.CodedEnumConverter;
import jakarta.persistence.Converter;

public enum EmployeeStatus implements CodedEnum {
    ACTIVE("active"),
    INACTIVE("inactive");

    private final String code;

    EmployeeStatus(String code) {
        this.code = code;
    }

    @Override
    public String getCode() {
        return code;
    }

    @Converter
    public static class DbConverter extends CodedEnumConverter<EmployeeStatus> {
        public DbConverter() {
            super(EmployeeStatus.class);
        }
    }
}
