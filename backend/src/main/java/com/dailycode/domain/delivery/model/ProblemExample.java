package com.dailycode.domain.delivery.model;

public record ProblemExample(String input, String output, String explanation) {}
