package com.incoresoft.timeAttendance.domain.request.dto;

import com.incoresoft.timeAttendance.domain.shared.CodedEnum;
import com.incoresoft.timeAttendance.domain.shared.CodedEnumConverter;
import jakarta.persistence.Converter;

import java.util.EnumSet;
import java.util.Set;

public enum RequestStatus implements CodedEnum {
    PENDING("pending"),
    APPROVED("approved"),
    REJECTED("rejected");

    /** Statuses that participate in summary totals. */
    public static final Set<RequestStatus> OPEN_OR_APPROVED = EnumSet.of(PENDING, APPROVED);

    private final String code;

    RequestStatus(String code) {
        this.code = code;
    }

    @Override
    public String getCode() {
        return code;
    }

    @Converter
    public static class DbConverter extends CodedEnumConverter<RequestStatus> {
        public DbConverter() {
            super(RequestStatus.class);
        }
    }
}
