package com.quantsim.backend.exception;

public class NotFoundException extends SimulationException {
    public NotFoundException(String message) {
        super(message);
    }
}
