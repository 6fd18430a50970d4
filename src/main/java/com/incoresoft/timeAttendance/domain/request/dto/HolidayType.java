package com.incoresoft.timeAttendance.domain.request.dto;

import com.incoresoft.timeAttendance.domain.shared.CodedEnum;
import com.incoresoft.timeAttendance.domain.shared.CodedEnumConverter;
import jakarta.persistence.Converter;

public enum HolidayType implements CodedEnum {
    DAY("day"),
    RANGE("range");

    private final String code;

    HolidayType(String code) {
        this.code = code;
    }

    @Override
    public String getCode() {
        return code;
    }

    @Converter
    public static class DbConverter extends CodedEnumConverter<HolidayType> {
        public DbConverter() {
            super(HolidayType.class);
        }
    }
}
