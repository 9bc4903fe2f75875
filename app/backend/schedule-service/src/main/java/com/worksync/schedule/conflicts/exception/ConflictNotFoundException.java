package com.worksync.schedule.conflicts.exception;

public class ConflictNotFoundException extends RuntimeException {
    public ConflictNotFoundException(String message) {
        super(message);
    }

    public ConflictNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
