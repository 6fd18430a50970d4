package com.incoresoft.timeAttendance.domain.attendance.dto;

import com.fasterxml.jackson.annotation.JsonValue;
import com.incoresoft.timeAttendance.domain.shared.CodedEnum;
import com.incoresoft.timeAttendance.domain.shared.CodedEnumConverter;
import jakarta.persistence.Converter;

import java.util.EnumSet;
import java.util.Set;

public enum AttendanceStatus implements CodedEnum {
    PRESENT("present"),
    HALF_DAY("half-day"),
    PARTIAL("partial"),
    IN_OFFICE("in_office"),
    LEAVE("leave"),
    PERMISSION("permission"),
    ABSENT("absent");

    /** Statuses that count a day as present in summaries even without stored bounds. */
    public static final Set<AttendanceStatus> WORKED = EnumSet.of(PRESENT, HALF_DAY, PARTIAL);

    private final String code;

    AttendanceStatus(String code) {
        this.code = code;
    }

    @Override
    @JsonValue
    public String getCode() {
        return code;
    }

    public static AttendanceStatus fromCode(String code) {
        return CodedEnum.fromCode(AttendanceStatus.class, code);
    }

    @Converter
    public static class DbConverter extends CodedEnumConverter<AttendanceStatus> {
        public DbConverter() {
            super(AttendanceStatus.class);
        }
    }
}
