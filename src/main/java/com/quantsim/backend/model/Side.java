package com.quantsim.backend.model;

public enum Side {
    BUY,
    SELL
}
