package com.tutorhub.exception;

public class CannotBeUnscheduledException extends RuntimeException {

    public CannotBeUnscheduledException(String message) {
        super(message);
    }
}
