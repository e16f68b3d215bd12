package com.dailycode.interfaces.api.dto;

public record UpdatePreferencesRequest(
        String language,
        String difficulty
) {}
