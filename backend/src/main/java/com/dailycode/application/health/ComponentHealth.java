package com.dailycode.application.health;

public record ComponentHealth(String name, boolean healthy, String detail) {

    static ComponentHealth up(String name, String detail) {
        return new ComponentHealth(name, true, detail);
    }

    static ComponentHealth down(String name, String detail) {
        return new ComponentHealth(name, false, detail);
    }
}
