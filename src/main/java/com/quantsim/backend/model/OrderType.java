package com.quantsim.backend.model;

public enum OrderType {
    MARKET,
    LIMIT
}
