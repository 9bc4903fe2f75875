package com.worksync.schedule.schedules.exception;

public class ScheduleEntryNotFoundException extends RuntimeException {
    public ScheduleEntryNotFoundException(String message) {
        super(message);
    }

    public ScheduleEntryNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
