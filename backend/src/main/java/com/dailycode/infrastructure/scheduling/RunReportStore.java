package com.dailycode.infrastructure.scheduling;

import com.dailycode.application.delivery.RunReport;
import com.dailycode.config.DailyCodeProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * The most recent run reports, newest first. Memory only; lost on restart.
 */
@Component
public class RunReportStore {

    private final int capacity;
    private final Deque<RunReport> reports = new ArrayDeque<>();

    public RunReportStore(DailyCodeProperties properties) {
        this(properties.delivery().recentReportCapacity());
    }

    RunReportStore(int capacity) {
        this.capacity = capacity;
    }

    public synchronized void add(RunReport report) {
        reports.addFirst(report);
        while (reports.size() > capacity) {
            reports.removeLast();
        }
    }

    public synchronized List<RunReport> recent() {
        return new ArrayList<>(reports);
    }

    public synchronized Optional<RunReport> latest() {
        return Optional.ofNullable(reports.peekFirst());
    }
}
