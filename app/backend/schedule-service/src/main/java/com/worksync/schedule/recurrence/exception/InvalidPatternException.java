package com.worksync.schedule.recurrence.exception;

public class InvalidPatternException extends RuntimeException {
    public InvalidPatternException(String message) {
        super(message);
    }

    public InvalidPatternException(String message, Throwable cause) {
        super(message, cause);
    }
}
