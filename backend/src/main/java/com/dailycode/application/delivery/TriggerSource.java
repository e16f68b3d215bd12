package com.dailycode.application.delivery;

public enum TriggerSource {
    CADENCE,
    MANUAL,
    CATCH_UP
}
