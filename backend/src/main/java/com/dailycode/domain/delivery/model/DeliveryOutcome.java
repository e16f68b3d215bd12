package com.dailycode.domain.delivery.model;

public enum DeliveryOutcome {
    SUCCESS,
    FAILURE
}
