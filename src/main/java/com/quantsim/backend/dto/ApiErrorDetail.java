package com.quantsim.backend.dto;

public record ApiErrorDetail(String field, String issue) {}
