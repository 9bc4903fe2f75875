package com.worksync.schedule.schedules.exception;

public class InvalidScopeException extends RuntimeException {
    public InvalidScopeException(String message) {
        super(message);
    }

    public InvalidScopeException(String message, Throwable cause) {
        super(message, cause);
    }
}
