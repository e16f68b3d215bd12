package com.dailycode.infrastructure.scheduling;

import com.dailycode.application.delivery.DeliveryCoordinator;
import com.dailycode.application.delivery.RunReport;
import com.dailycode.application.delivery.TriggerSource;
import com.dailycode.config.DailyCodeProperties;
import com.dailycode.domain.common.exception.StoreUnavailableException;
import com.dailycode.domain.delivery.service.DeliveryHistory;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Fires a delivery run once a day at the configured local time.
 * <p>
 * At most one run executes at a time within this process: a trigger that arrives while a run is in
 * progress is skipped, never queued. The next fire time is always computed from the injected clock and
 * never moves backwards.
 */
@Slf4j
@Component
public class DeliveryTriggerScheduler {

    private final DeliveryCoordinator coordinator;
    private final DeliveryHistory deliveryHistory;
    private final RunReportStore reportStore;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final LocalTime fireAt;
    private final ZoneId zone;
    private final CatchUpPolicy catchUpPolicy;

    private final AtomicBoolean runInProgress = new AtomicBoolean();

    private ScheduledFuture<?> nextRun;
    private Instant lastScheduledFire;
    private boolean started;
    private boolean stopped;

    public DeliveryTriggerScheduler(DeliveryCoordinator coordinator,
                                    DeliveryHistory deliveryHistory,
                                    RunReportStore reportStore,
                                    TaskScheduler taskScheduler,
                                    Clock clock,
                                    DailyCodeProperties properties) {
        this.coordinator = coordinator;
        this.deliveryHistory = deliveryHistory;
        this.reportStore = reportStore;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.fireAt = LocalTime.of(properties.schedule().hour(), properties.schedule().minute());
        this.zone = properties.schedule().zoneId();
        this.catchUpPolicy = properties.schedule().catchUp();
    }

    /**
     * Starts the daily cadence. Subsequent calls are no-ops.
     */
    public synchronized void start() {
        if (stopped) {
            throw new IllegalStateException("Scheduler has been stopped");
        }
        if (started) {
            return;
        }
        started = true;
        log.info("Delivery scheduler started - daily at {} {}, catch-up: {}", fireAt, zone, catchUpPolicy);

        if (catchUpPolicy == CatchUpPolicy.RUN_ONCE && catchUpDue()) {
            taskScheduler.schedule(() -> fire(TriggerSource.CATCH_UP), clock.instant());
        }
        scheduleNext();
    }

    /**
     * Runs the coordinator on the calling thread unless a run is already in progress.
     */
    public TriggerResult triggerNow() {
        return fire(TriggerSource.MANUAL);
    }

    @PreDestroy
    public synchronized void stop() {
        stopped = true;
        if (nextRun != null) {
            nextRun.cancel(false);
            nextRun = null;
        }
    }

    public synchronized SchedulerStatus status() {
        return new SchedulerStatus(
                started && !stopped,
                runInProgress.get(),
                "daily at " + fireAt + " " + zone,
                catchUpPolicy.name(),
                lastScheduledFire == null || stopped ? null : lastScheduledFire.atZone(zone));
    }

    public boolean isRunInProgress() {
        return runInProgress.get();
    }

    /**
     * First occurrence strictly after {@code now}, and never earlier than one already scheduled.
     */
    synchronized Instant nextFireTime(Instant now) {
        Instant next = occurrenceAfter(now);
        if (lastScheduledFire != null && !next.isAfter(lastScheduledFire)) {
            next = occurrenceAfter(lastScheduledFire);
        }
        return next;
    }

    /**
     * Latest occurrence at or before {@code now}.
     */
    Instant previousFireTime(Instant now) {
        LocalDate today = now.atZone(zone).toLocalDate();
        Instant candidate = ZonedDateTime.of(today, fireAt, zone).toInstant();
        return candidate.isAfter(now)
                ? ZonedDateTime.of(today.minusDays(1), fireAt, zone).toInstant()
                : candidate;
    }

    private Instant occurrenceAfter(Instant instant) {
        LocalDate day = instant.atZone(zone).toLocalDate();
        Instant candidate = ZonedDateTime.of(day, fireAt, zone).toInstant();
        return candidate.isAfter(instant)
                ? candidate
                : ZonedDateTime.of(day.plusDays(1), fireAt, zone).toInstant();
    }

    private boolean catchUpDue() {
        Instant previous = previousFireTime(clock.instant());
        Optional<Instant> lastActivity;
        try {
            lastActivity = Stream.of(deliveryHistory.lastRunStartedAt(), deliveryHistory.lastAttemptAt())
                    .flatMap(Optional::stream)
                    .max(Comparator.naturalOrder());
        } catch (StoreUnavailableException e) {
            log.error("Cannot evaluate catch-up, {} unavailable", e.storeName(), e);
            return false;
        }
        boolean due = lastActivity.map(last -> last.isBefore(previous)).orElse(true);
        if (due) {
            log.info("Occurrence at {} was missed (last run: {}), running catch-up",
                    previous.atZone(zone), lastActivity.map(Instant::toString).orElse("never"));
        }
        return due;
    }

    private synchronized void scheduleNext() {
        if (stopped) {
            return;
        }
        Instant next = nextFireTime(clock.instant());
        lastScheduledFire = next;
        nextRun = taskScheduler.schedule(this::onCadence, next);
        log.info("Next delivery run at {}", next.atZone(zone));
    }

    private void onCadence() {
        scheduleNext();
        fire(TriggerSource.CADENCE);
    }

    private TriggerResult fire(TriggerSource source) {
        if (!runInProgress.compareAndSet(false, true)) {
            log.warn("{} trigger skipped, a delivery run is already in progress", source);
            return TriggerResult.skipped(source);
        }
        try {
            RunReport report = coordinator.runOnce(clock.instant(), source);
            reportStore.add(report);
            return TriggerResult.completed(report);
        } catch (StoreUnavailableException e) {
            log.error("Delivery run aborted, {} unavailable", e.storeName(), e);
            return TriggerResult.failed(source, e);
        } catch (RuntimeException e) {
            log.error("Delivery run aborted unexpectedly", e);
            return TriggerResult.failed(source, e);
        } finally {
            runInProgress.set(false);
        }
    }
}
