package com.quantsim.backend.model;

import java.time.Instant;

public record EquityPoint(Instant timestamp, double equity) {}
