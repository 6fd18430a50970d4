package com.incoresoft.timeAttendance.domain.scan.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.incoresoft.timeAttendance.domain.shared.CodedEnum;
import com.incoresoft.timeAttendance.domain.shared.CodedEnumConverter;
import jakarta.persistence.Converter;

public enum ScanDirection implements CodedEnum {
    CHECK_IN("check-in"),
    CHECK_OUT("check-out");

    private final String code;

    ScanDirection(String code) {
        this.code = code;
    }

    @Override
    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ScanDirection fromCode(String code) {
        return CodedEnum.fromCode(ScanDirection.class, code);
    }

    @Converter
    public static class DbConverter extends CodedEnumConverter<ScanDirection> {
        public DbConverter() {
            super(ScanDirection.class);
        }
    }
}
