package com.dailycode.domain.delivery.service;

import com.dailycode.domain.delivery.model.DeliveryRecord;
import com.dailycode.domain.delivery.model.DeliveryRun;
import com.dailycode.domain.subscriber.model.Language;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Append-only ledger of delivery attempts.
 * All methods throw {@code HistoryUnavailableException} when the backing store cannot be reached.
 */
public interface DeliveryHistory {

    /**
     * Problem identities with a success record for the subscriber.
     */
    Set<String> deliveredProblemIds(String subscriberId);

    /**
     * Success snapshot for several subscribers at once. Every requested identity is present in the result.
     */
    Map<String, Set<String>> deliveredProblemIds(Collection<String> subscriberIds);

    /**
     * Appends a success record unless one already exists for the pair, in which case the existing
     * record is returned and nothing is written.
     */
    DeliveryRecord recordSuccess(String subscriberId, String problemId, Language language, Instant at);

    DeliveryRecord recordFailure(String subscriberId, String problemId, Language language, Instant at, String reason);

    List<DeliveryRecord> findBySubscriber(String subscriberId);

    Optional<Instant> lastAttemptAt();

    /**
     * Marks a finished run, including runs without any subscriber.
     */
    void recordRun(DeliveryRun run);

    /**
     * Start of the most recent finished run.
     */
    Optional<Instant> lastRunStartedAt();

    long countAttempts();
}
