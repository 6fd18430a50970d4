package com.incoresoft.timeAttendance.domain.report.service;

/**
 * Summary could not be computed from stored data.
 */
public class AggregationException extends RuntimeException {
    public AggregationException(String message, Throwable cause) {
        super(message, cause);
    }
}
