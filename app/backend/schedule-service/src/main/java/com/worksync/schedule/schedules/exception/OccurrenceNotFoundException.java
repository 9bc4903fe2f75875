package com.worksync.schedule.schedules.exception;

public class OccurrenceNotFoundException extends RuntimeException {
    public OccurrenceNotFoundException(String message) {
        super(message);
    }

    public OccurrenceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
