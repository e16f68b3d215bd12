package com.dailycode.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
