package com.dailycode.infrastructure.persistence;

import com.dailycode.domain.common.exception.DirectoryUnavailableException;
import com.dailycode.domain.subscriber.model.DifficultyPreference;
import com.dailycode.domain.subscriber.model.Language;
import com.dailycode.domain.subscriber.model.Subscriber;
import com.dailycode.domain.subscriber.repository.SubscriberRepository;
import com.dailycode.domain.subscriber.service.SubscriberDirectory;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

@Repository
public class JpaSubscriberDirectory implements SubscriberDirectory {

    private final SubscriberRepository subscriberRepository;
    private final Clock clock;
    private final StoreTransactions transactions;

    public JpaSubscriberDirectory(SubscriberRepository subscriberRepository, Clock clock,
                                  PlatformTransactionManager transactionManager) {
        this.subscriberRepository = subscriberRepository;
        this.clock = clock;
        this.transactions = new StoreTransactions(transactionManager, DirectoryUnavailableException::new);
    }

    @Override
    public List<Subscriber> findActive() {
        return transactions.read("load active subscribers", subscriberRepository::findByActiveTrueOrderByIdAsc);
    }

    @Override
    public Optional<Subscriber> find(String subscriberId) {
        return transactions.read("look up subscriber", () -> subscriberRepository.findById(subscriberId));
    }

    @Override
    public Subscriber register(String subscriberId, Language language, DifficultyPreference difficulty) {
        return transactions.write("register subscriber", () -> subscriberRepository.save(Subscriber.builder()
                .id(subscriberId)
                .language(language)
                .difficulty(difficulty)
                .createdAt(clock.instant())
                .build()));
    }

    @Override
    public Subscriber reactivate(String subscriberId, Language language, DifficultyPreference difficulty) {
        return transactions.write("reactivate subscriber", () -> {
            Subscriber subscriber = load(subscriberId);
            subscriber.updatePreferences(language, difficulty, clock.instant());
            subscriber.activate(clock.instant());
            return subscriber;
        });
    }

    @Override
    public Subscriber deactivate(String subscriberId) {
        return transactions.write("deactivate subscriber", () -> {
            Subscriber subscriber = load(subscriberId);
            subscriber.deactivate(clock.instant());
            return subscriber;
        });
    }

    @Override
    public Subscriber updatePreferences(String subscriberId, Language language, DifficultyPreference difficulty) {
        return transactions.write("update subscriber preferences", () -> {
            Subscriber subscriber = load(subscriberId);
            subscriber.updatePreferences(language, difficulty, clock.instant());
            return subscriber;
        });
    }

    @Override
    public long countActive() {
        return transactions.read("count active subscribers", subscriberRepository::countByActiveTrue);
    }

    private Subscriber load(String subscriberId) {
        return subscriberRepository.findById(subscriberId)
                .orElseThrow(() -> new NoSuchElementException("Unknown subscriber: " + subscriberId));
    }
}
