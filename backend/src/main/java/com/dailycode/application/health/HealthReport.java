package com.dailycode.application.health;

import java.util.List;

/**
 * @param stats null when a store needed for the statistics is unavailable
 */
public record HealthReport(List<ComponentHealth> components, SystemStats stats) {

    public boolean isHealthy() {
        return components.stream().allMatch(ComponentHealth::healthy);
    }
}
