package com.incoresoft.timeAttendance.domain.calendar.dto;

/**
 * What a calendar day means for one employee, in precedence order.
 */
public enum DayClassification {
    NOT_YET_JOINED,
    FUTURE_DATE,
    HOLIDAY,
    DAY_OFF,
    DAY_OFF_PRESENT,
    LEAVE,
    PERMISSION,
    PRESENT,
    ABSENT
}
