package com.simscan.api.dto;

public record CreditRequestBody(Integer amount) {}
