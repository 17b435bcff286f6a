package com.quantsim.backend.exception;

public class BadRequestException extends SimulationException {
    public BadRequestException(String message) {
        super(message);
    }
}
