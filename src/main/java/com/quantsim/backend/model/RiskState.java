package com.quantsim.backend.model;

/**
 * Risk manager state. {@code HALTED} is terminal for the rest of a run or session.
 */
public enum RiskState {
    NORMAL,
    HALTED
}
