package com.dailycode.infrastructure.persistence;

import com.dailycode.domain.common.exception.HistoryUnavailableException;
import com.dailycode.domain.delivery.model.DeliveryOutcome;
import com.dailycode.domain.delivery.model.DeliveryRecord;
import com.dailycode.domain.delivery.model.DeliveryRun;
import com.dailycode.domain.delivery.repository.DeliveryRecordRepository;
import com.dailycode.domain.delivery.repository.DeliveryRunRepository;
import com.dailycode.domain.delivery.service.DeliveryHistory;
import com.dailycode.domain.subscriber.model.Language;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Repository
public class JpaDeliveryHistory implements DeliveryHistory {

    private final DeliveryRecordRepository recordRepository;
    private final DeliveryRunRepository runRepository;
    private final StoreTransactions transactions;

    public JpaDeliveryHistory(DeliveryRecordRepository recordRepository, DeliveryRunRepository runRepository,
                              PlatformTransactionManager transactionManager) {
        this.recordRepository = recordRepository;
        this.runRepository = runRepository;
        this.transactions = new StoreTransactions(transactionManager, HistoryUnavailableException::new);
    }

    @Override
    public Set<String> deliveredProblemIds(String subscriberId) {
        return transactions.read("load delivery history",
                () -> Set.copyOf(recordRepository.findProblemIds(subscriberId, DeliveryOutcome.SUCCESS)));
    }

    @Override
    public Map<String, Set<String>> deliveredProblemIds(Collection<String> subscriberIds) {
        Map<String, Set<String>> delivered = new HashMap<>();
        subscriberIds.forEach(id -> delivered.put(id, new HashSet<>()));
        if (subscriberIds.isEmpty()) {
            return delivered;
        }
        List<DeliveryRecord> successes = transactions.read("load delivery history",
                () -> recordRepository.findBySubscriberIdInAndOutcome(subscriberIds, DeliveryOutcome.SUCCESS));
        successes.forEach(r -> delivered.computeIfAbsent(r.getSubscriberId(), k -> new HashSet<>())
                .add(r.getProblemId()));
        return delivered;
    }

    @Override
    public DeliveryRecord recordSuccess(String subscriberId, String problemId, Language language, Instant at) {
        return transactions.write("record delivery success", () -> {
            Optional<DeliveryRecord> existing = recordRepository
                    .findFirstBySubscriberIdAndProblemIdAndOutcome(subscriberId, problemId, DeliveryOutcome.SUCCESS);
            if (existing.isPresent()) {
                log.warn("Success already recorded - subscriber: {}, problem: {}", subscriberId, problemId);
                return existing.get();
            }
            return recordRepository.save(DeliveryRecord.success(subscriberId, problemId, language, at));
        });
    }

    @Override
    public DeliveryRecord recordFailure(String subscriberId, String problemId, Language language, Instant at,
                                        String reason) {
        return transactions.write("record delivery failure",
                () -> recordRepository.save(DeliveryRecord.failure(subscriberId, problemId, language, at, reason)));
    }

    @Override
    public List<DeliveryRecord> findBySubscriber(String subscriberId) {
        return transactions.read("load delivery history",
                () -> recordRepository.findBySubscriberIdOrderByAttemptedAtAsc(subscriberId));
    }

    @Override
    public Optional<Instant> lastAttemptAt() {
        return transactions.read("load last delivery attempt", recordRepository::findLatestAttemptedAt);
    }

    @Override
    public void recordRun(DeliveryRun run) {
        transactions.write("record delivery run", () -> runRepository.save(run));
    }

    @Override
    public Optional<Instant> lastRunStartedAt() {
        return transactions.read("load last delivery run", runRepository::findLatestStartedAt);
    }

    @Override
    public long countAttempts() {
        return transactions.read("count delivery attempts", recordRepository::count);
    }
}
