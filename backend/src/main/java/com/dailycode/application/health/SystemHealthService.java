package com.dailycode.application.health;

import com.dailycode.config.DailyCodeProperties;
import com.dailycode.domain.common.exception.StoreUnavailableException;
import com.dailycode.domain.delivery.service.DeliveryHistory;
import com.dailycode.domain.delivery.service.MessageSender;
import com.dailycode.domain.delivery.service.SolutionGenerator;
import com.dailycode.domain.problem.model.Difficulty;
import com.dailycode.domain.problem.service.ProblemCatalog;
import com.dailycode.domain.subscriber.model.DifficultyPreference;
import com.dailycode.domain.subscriber.model.Language;
import com.dailycode.domain.subscriber.service.SubscriberDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Checks every store and collaborator. Read-only: nothing is sent and no delivery is recorded.
 */
@Slf4j
@Service
public class SystemHealthService {

    private final SubscriberDirectory subscriberDirectory;
    private final ProblemCatalog problemCatalog;
    private final DeliveryHistory deliveryHistory;
    private final SolutionGenerator solutionGenerator;
    private final MessageSender messageSender;
    private final Set<Language> supportedLanguages;

    public SystemHealthService(SubscriberDirectory subscriberDirectory,
                               ProblemCatalog problemCatalog,
                               DeliveryHistory deliveryHistory,
                               SolutionGenerator solutionGenerator,
                               MessageSender messageSender,
                               DailyCodeProperties properties) {
        this.subscriberDirectory = subscriberDirectory;
        this.problemCatalog = problemCatalog;
        this.deliveryHistory = deliveryHistory;
        this.solutionGenerator = solutionGenerator;
        this.messageSender = messageSender;
        this.supportedLanguages = properties.supportedLanguages();
    }

    public HealthReport check() {
        List<ComponentHealth> components = new ArrayList<>();

        components.add(checkStore("subscriber directory",
                () -> subscriberDirectory.countActive() + " active subscribers"));
        components.add(checkStore("problem catalog",
                () -> problemCatalog.countByDifficulty().values().stream().mapToLong(Long::longValue).sum()
                        + " problems"));
        components.add(checkStore("delivery history",
                () -> deliveryHistory.countAttempts() + " recorded attempts"));

        components.add(solutionGenerator.isReachable()
                ? ComponentHealth.up("text generation", "endpoint reachable")
                : ComponentHealth.down("text generation", "endpoint unreachable"));
        components.add(messageSender.isReachable()
                ? ComponentHealth.up("message transport", messageSender.transportName())
                : ComponentHealth.down("message transport", messageSender.transportName() + " unreachable"));

        HealthReport report = new HealthReport(List.copyOf(components), statsOrNull());
        components.forEach(c -> log.info("Health [{}] {} - {}", c.healthy() ? "UP" : "DOWN", c.name(), c.detail()));
        return report;
    }

    /**
     * @throws StoreUnavailableException when a store cannot be reached
     */
    public SystemStats stats() {
        Map<Difficulty, Long> byDifficulty = problemCatalog.countByDifficulty();
        return new SystemStats(
                subscriberDirectory.countActive(),
                byDifficulty.values().stream().mapToLong(Long::longValue).sum(),
                byDifficulty,
                deliveryHistory.countAttempts(),
                supportedLanguages.stream().map(Language::code).sorted().toList(),
                Arrays.stream(DifficultyPreference.values()).map(d -> d.name().toLowerCase(Locale.ROOT)).toList());
    }

    private SystemStats statsOrNull() {
        try {
            return stats();
        } catch (StoreUnavailableException e) {
            log.warn("System statistics unavailable, {} unreachable", e.storeName());
            return null;
        }
    }

    private static ComponentHealth checkStore(String name, StoreCheck check) {
        try {
            return ComponentHealth.up(name, check.run());
        } catch (StoreUnavailableException e) {
            return ComponentHealth.down(name, e.getMessage());
        }
    }

    @FunctionalInterface
    private interface StoreCheck {
        String run();
    }
}
