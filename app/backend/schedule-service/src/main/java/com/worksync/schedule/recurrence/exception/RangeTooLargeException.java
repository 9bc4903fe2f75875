package com.worksync.schedule.recurrence.exception;

public class RangeTooLargeException extends RuntimeException {
    public RangeTooLargeException(String message) {
        super(message);
    }

    public RangeTooLargeException(String message, Throwable cause) {
        super(message, cause);
    }
}
