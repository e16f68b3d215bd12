package com.dailycode.application.delivery;

import com.dailycode.application.delivery.exception.NoContentAvailableException;
import com.dailycode.config.DailyCodeProperties;
import com.dailycode.domain.common.exception.StoreUnavailableException;
import com.dailycode.domain.delivery.model.DeliveryRun;
import com.dailycode.domain.delivery.model.PipelineOutcome;
import com.dailycode.domain.delivery.service.DeliveryHistory;
import com.dailycode.domain.problem.model.Problem;
import com.dailycode.domain.problem.service.ProblemCatalog;
import com.dailycode.domain.subscriber.model.Subscriber;
import com.dailycode.domain.subscriber.service.SubscriberDirectory;
import com.dailycode.infrastructure.pipeline.ContentPipeline;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one delivery pass over all active subscribers.
 * <p>
 * Store snapshots are taken once at the start of the run; an unreachable store aborts the run with a
 * {@link StoreUnavailableException} before any pipeline starts. After that every subscriber is handled
 * by exactly one worker task and no single subscriber's failure affects the others.
 */
@Slf4j
@Service
public class DeliveryCoordinator {

    private final SubscriberDirectory subscriberDirectory;
    private final ProblemCatalog problemCatalog;
    private final DeliveryHistory deliveryHistory;
    private final ProblemSelector problemSelector;
    private final ContentPipeline contentPipeline;
    private final Clock clock;
    private final ZoneId zone;
    private final int workerPoolSize;
    private final Duration runTimeout;
    private final Duration shutdownGrace;

    private volatile ExecutorService activeExecutor;

    public DeliveryCoordinator(SubscriberDirectory subscriberDirectory,
                               ProblemCatalog problemCatalog,
                               DeliveryHistory deliveryHistory,
                               ProblemSelector problemSelector,
                               ContentPipeline contentPipeline,
                               Clock clock,
                               DailyCodeProperties properties) {
        this.subscriberDirectory = subscriberDirectory;
        this.problemCatalog = problemCatalog;
        this.deliveryHistory = deliveryHistory;
        this.problemSelector = problemSelector;
        this.contentPipeline = contentPipeline;
        this.clock = clock;
        this.zone = properties.schedule().zoneId();
        this.workerPoolSize = properties.delivery().workerPoolSize();
        this.runTimeout = properties.delivery().runTimeout();
        this.shutdownGrace = properties.delivery().shutdownGrace();
    }

    public RunReport runOnce(Instant asOf) {
        return runOnce(asOf, TriggerSource.MANUAL);
    }

    /**
     * @param asOf   instant whose calendar date (in the schedule zone) is the delivery date
     * @param source what triggered the run, carried into the report
     * @throws StoreUnavailableException when a snapshot cannot be loaded
     */
    public RunReport runOnce(Instant asOf, TriggerSource source) {
        ExecutorService previous = activeExecutor;
        if (previous != null && !previous.isTerminated()) {
            throw new IllegalStateException("Workers of a previous delivery run are still active");
        }
        String runId = UUID.randomUUID().toString().substring(0, 8);
        Instant startedAt = clock.instant();
        LocalDate deliveryDate = LocalDate.ofInstant(asOf, zone);

        List<Subscriber> subscribers = subscriberDirectory.findActive();
        List<Problem> catalog = problemCatalog.findAll();
        Map<String, Set<String>> delivered = deliveryHistory.deliveredProblemIds(
                subscribers.stream().map(Subscriber::getId).toList());

        log.info("Delivery run {} started - source: {}, date: {}, subscribers: {}, problems: {}",
                runId, source, deliveryDate, subscribers.size(), catalog.size());

        List<RunEntry> entries = subscribers.isEmpty()
                ? List.of()
                : dispatch(runId, subscribers, catalog, delivered, deliveryDate);

        RunReport report = new RunReport(runId, source, startedAt, clock.instant(), entries);
        log.info("Delivery {}", report.summary());
        recordRun(report);
        return report;
    }

    private void recordRun(RunReport report) {
        boolean interrupted = Thread.interrupted();
        try {
            deliveryHistory.recordRun(DeliveryRun.builder()
                    .runId(report.runId())
                    .source(report.source().name())
                    .startedAt(report.startedAt())
                    .finishedAt(report.finishedAt())
                    .subscribers(report.entries().size())
                    .sent((int) report.count(EntryOutcome.SUCCESS))
                    .build());
        } catch (StoreUnavailableException e) {
            log.error("Delivery run {} finished but could not be recorded", report.runId(), e);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private List<RunEntry> dispatch(String runId, List<Subscriber> subscribers, List<Problem> catalog,
                                    Map<String, Set<String>> delivered, LocalDate deliveryDate) {
        int threads = Math.min(workerPoolSize, subscribers.size());
        ExecutorService executor = Executors.newFixedThreadPool(threads,
                new CustomizableThreadFactory("delivery-" + runId + "-"));
        activeExecutor = executor;

        List<SubscriberTask> tasks = subscribers.stream()
                .map(s -> new SubscriberTask(s, catalog, delivered.getOrDefault(s.getId(), Set.of()), deliveryDate))
                .toList();
        List<Future<RunEntry>> futures = new ArrayList<>(tasks.size());
        try {
            tasks.forEach(task -> futures.add(executor.submit(task)));
            awaitCompletion(runId, executor, futures);
        } finally {
            if (executor.isTerminated()) {
                activeExecutor = null;
            }
        }

        List<RunEntry> entries = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            entries.add(collect(tasks.get(i), futures.get(i)));
        }
        return entries;
    }

    private void awaitCompletion(String runId, ExecutorService executor, List<Future<RunEntry>> futures) {
        long deadline = System.nanoTime() + runTimeout.toNanos();
        boolean completed = true;
        for (Future<RunEntry> future : futures) {
            try {
                future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                log.warn("Delivery run {} exceeded its timeout of {}, interrupting remaining work", runId, runTimeout);
                completed = false;
                break;
            } catch (InterruptedException e) {
                log.warn("Delivery run {} cancelled, interrupting remaining work", runId);
                Thread.currentThread().interrupt();
                completed = false;
                break;
            } catch (ExecutionException | CancellationException e) {
                log.error("Delivery task failed unexpectedly in run {}", runId, e);
            }
        }

        if (completed) {
            executor.shutdown();
        } else {
            executor.shutdownNow();
        }

        // A worker stuck in a collaborator still owns its subscriber, so the run only ends once every worker has.
        boolean wasInterrupted = Thread.interrupted();
        try {
            while (!executor.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Delivery workers of run {} still busy after {}, waiting for them to finish",
                        runId, shutdownGrace);
            }
        } catch (InterruptedException e) {
            log.warn("Stopped waiting for the delivery workers of run {}, they stay registered until they finish",
                    runId);
            wasInterrupted = true;
        } finally {
            if (wasInterrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private RunEntry collect(SubscriberTask task, Future<RunEntry> future) {
        String subscriberId = task.subscriber.getId();
        if (future.isDone() && !future.isCancelled()) {
            try {
                return future.get();
            } catch (ExecutionException e) {
                return RunEntry.failed(subscriberId, task.selectedProblemId, String.valueOf(e.getCause()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return RunEntry.interrupted(subscriberId, task.selectedProblemId);
            }
        }
        return task.started.get()
                ? RunEntry.interrupted(subscriberId, task.selectedProblemId)
                : RunEntry.notAttempted(subscriberId);
    }

    private RunEntry deliver(Subscriber subscriber, List<Problem> catalog, Set<String> delivered, LocalDate deliveryDate,
                             SubscriberTask task) {
        Problem problem;
        try {
            problem = problemSelector.select(subscriber, catalog, delivered, deliveryDate);
        } catch (NoContentAvailableException e) {
            log.warn("No content available - subscriber: {}, preference: {}",
                    subscriber.getId(), subscriber.getDifficulty());
            return RunEntry.noContent(subscriber.getId());
        }
        task.selectedProblemId = problem.getId();

        PipelineOutcome outcome = contentPipeline.execute(problem, subscriber);
        return record(subscriber, problem, outcome);
    }

    private RunEntry record(Subscriber subscriber, Problem problem, PipelineOutcome outcome) {
        // A pending interrupt would abort the history write, so it is parked until the write is done.
        boolean interrupted = Thread.interrupted();
        try {
            Instant at = clock.instant();
            if (outcome.sent()) {
                try {
                    deliveryHistory.recordSuccess(subscriber.getId(), problem.getId(), subscriber.getLanguage(), at);
                } catch (StoreUnavailableException e) {
                    log.error("Delivered but not recorded - subscriber: {}, problem: {}",
                            subscriber.getId(), problem.getId(), e);
                    return RunEntry.failed(subscriber.getId(), problem.getId(),
                            "Delivered but not recorded: " + e.getMessage());
                }
                log.info("Delivered - subscriber: {}, problem: {}, degraded: {}",
                        subscriber.getId(), problem.getId(), outcome.isDegraded());
                return RunEntry.success(subscriber.getId(), problem.getId(), outcome.degradation());
            }

            try {
                deliveryHistory.recordFailure(subscriber.getId(), problem.getId(), subscriber.getLanguage(), at,
                        outcome.failure().describe());
            } catch (StoreUnavailableException e) {
                log.error("Could not record failed delivery - subscriber: {}, problem: {}",
                        subscriber.getId(), problem.getId(), e);
            }
            log.error("Delivery failed - subscriber: {}, problem: {}, {}",
                    subscriber.getId(), problem.getId(), outcome.failure().describe());
            return RunEntry.failed(subscriber.getId(), problem.getId(), outcome.failure());
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Interrupts the workers of a run in progress. Their outcomes are still recorded.
     */
    @PreDestroy
    public void cancelActiveRun() {
        ExecutorService executor = activeExecutor;
        if (executor != null) {
            log.warn("Shutting down with a delivery run in progress, interrupting workers");
            executor.shutdownNow();
        }
    }

    final class SubscriberTask implements Callable<RunEntry> {

        private final Subscriber subscriber;
        private final List<Problem> catalog;
        private final Set<String> delivered;
        private final LocalDate deliveryDate;
        private final AtomicBoolean started = new AtomicBoolean();
        private volatile String selectedProblemId;

        SubscriberTask(Subscriber subscriber, List<Problem> catalog, Set<String> delivered, LocalDate deliveryDate) {
            this.subscriber = subscriber;
            this.catalog = catalog;
            this.delivered = delivered;
            this.deliveryDate = deliveryDate;
        }

        @Override
        public RunEntry call() {
            started.set(true);
            try {
                return deliver(subscriber, catalog, delivered, deliveryDate, this);
            } catch (RuntimeException e) {
                log.error("Unexpected failure delivering to {}", subscriber.getId(), e);
                return RunEntry.failed(subscriber.getId(), selectedProblemId, e.getClass().getSimpleName()
                        + ": " + e.getMessage());
            }
        }
    }
}
