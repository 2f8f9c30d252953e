package com.punchwheel.exception;

public class AlreadyRunningException extends RuntimeException {
    public AlreadyRunningException(String message) { super(message); }
}
