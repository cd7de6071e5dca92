package com.tutorhub.exception;

/**
 * A lesson cannot be placed on the requested timeline entry: it is already scheduled,
 * the entry is taken, the lesson types differ, or the entry falls outside working hours.
 */
public class CannotBeScheduledException extends RuntimeException {

    public CannotBeScheduledException(String message) {
        super(message);
    }
}
