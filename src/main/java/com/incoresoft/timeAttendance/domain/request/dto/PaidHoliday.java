package com.incoresoft.timeAttendance.domain.request.dto;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;

import java.time.LocalDate;

/**
 * Company-wide paid holiday, either a single day or an inclusive range.
 */
@Entity
@Table(name = "paid_holidays")
@Data
public class PaidHoliday {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Convert(converter = HolidayType.DbConverter.class)
    @Column(name = "holiday_type", nullable = false)
    private HolidayType holidayType;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    /** Only meaningful for {@link HolidayType#RANGE}. */
    @Column(name = "end_date")
    private LocalDate endDate;

    @Column(name = "description")
    private String description;

    public LocalDate effectiveEndDate() {
        return (holidayType == HolidayType.RANGE && endDate != null) ? endDate : startDate;
    }

    public boolean covers(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(effectiveEndDate());
    }
}
