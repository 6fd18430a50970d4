package com.incoresoft.timeAttendance.domain.shared;

import com.incoresoft.timeAttendance.domain.attendance.dto.AttendanceStatus;
import com.incoresoft.timeAttendance.domain.request.dto.RequestStatus;
import com.incoresoft.timeAttendance.domain.scan.dto.ScanDirection;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CodedEnumConverterTest {

    @Test
    void writesAndReadsCodes() {
        AttendanceStatus.DbConverter converter = new AttendanceStatus.DbConverter();

        assertThat(converter.convertToDatabaseColumn(AttendanceStatus.HALF_DAY)).isEqualTo("half-day");
        assertThat(converter.convertToEntityAttribute("in_office")).isEqualTo(AttendanceStatus.IN_OFFICE);
        assertThat(converter.convertToEntityAttribute(" Present ")).isEqualTo(AttendanceStatus.PRESENT);
        assertThat(new ScanDirection.DbConverter().convertToDatabaseColumn(ScanDirection.CHECK_IN)).isEqualTo("check-in");
    }

    @Test
    void nullsPassThrough() {
        RequestStatus.DbConverter converter = new RequestStatus.DbConverter();

        assertThat(converter.convertToDatabaseColumn(null)).isNull();
        assertThat(converter.convertToEntityAttribute(null)).isNull();
    }

    @Test
    void unknownCodeIsRejected() {
        assertThatThrownBy(() -> new AttendanceStatus.DbConverter().convertToEntityAttribute("holiday"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("holiday");
        assertThatThrownBy(() -> AttendanceStatus.fromCode(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
