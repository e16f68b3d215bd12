package com.dailycode.application.subscription;

import com.dailycode.application.subscription.exception.AlreadySubscribedException;
import com.dailycode.application.subscription.exception.InvalidPreferenceException;
import com.dailycode.application.subscription.exception.SubscriberNotFoundException;
import com.dailycode.config.DailyCodeProperties;
import com.dailycode.domain.delivery.model.DeliveryRecord;
import com.dailycode.domain.delivery.model.OutboundMessage;
import com.dailycode.domain.delivery.service.DeliveryHistory;
import com.dailycode.domain.delivery.service.MessageSender;
import com.dailycode.domain.problem.model.Difficulty;
import com.dailycode.domain.problem.model.Problem;
import com.dailycode.domain.problem.service.ProblemCatalog;
import com.dailycode.domain.subscriber.model.DifficultyPreference;
import com.dailycode.domain.subscriber.model.Language;
import com.dailycode.domain.subscriber.model.Subscriber;
import com.dailycode.domain.subscriber.service.SubscriberDirectory;
import com.dailycode.infrastructure.email.MessageComposer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Subscribe, unsubscribe and preference changes. Notices are best-effort and never fail the operation.
 */
@Slf4j
@Service
public class SubscriptionService {

    private static final Pattern EMAIL = Pattern.compile("^[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$");

    private final SubscriberDirectory subscriberDirectory;
    private final DeliveryHistory deliveryHistory;
    private final ProblemCatalog problemCatalog;
    private final MessageComposer messageComposer;
    private final MessageSender messageSender;
    private final Set<Language> supportedLanguages;

    public SubscriptionService(SubscriberDirectory subscriberDirectory,
                               DeliveryHistory deliveryHistory,
                               ProblemCatalog problemCatalog,
                               MessageComposer messageComposer,
                               MessageSender messageSender,
                               DailyCodeProperties properties) {
        this.subscriberDirectory = subscriberDirectory;
        this.deliveryHistory = deliveryHistory;
        this.problemCatalog = problemCatalog;
        this.messageComposer = messageComposer;
        this.messageSender = messageSender;
        this.supportedLanguages = properties.supportedLanguages();
    }

    public SubscriptionResult subscribe(String email, String languageCode, String difficultyCode) {
        String id = normalizeEmail(email);
        Language language = parseLanguage(languageCode == null ? Language.PYTHON.code() : languageCode);
        DifficultyPreference difficulty = parseDifficulty(difficultyCode == null ? "easy" : difficultyCode);

        SubscriptionResult result = subscriberDirectory.find(id)
                .map(existing -> {
                    if (existing.isActive()) {
                        throw new AlreadySubscribedException(id);
                    }
                    log.info("Reactivating subscriber {} - language: {}, difficulty: {}", id, language, difficulty);
                    return new SubscriptionResult(subscriberDirectory.reactivate(id, language, difficulty), true);
                })
                .orElseGet(() -> {
                    log.info("Registering subscriber {} - language: {}, difficulty: {}", id, language, difficulty);
                    return new SubscriptionResult(subscriberDirectory.register(id, language, difficulty), false);
                });

        notify(messageComposer.composeWelcome(result.subscriber()));
        return result;
    }

    public Subscriber unsubscribe(String email) {
        String id = normalizeEmail(email);
        Subscriber subscriber = subscriberDirectory.find(id)
                .orElseThrow(() -> new SubscriberNotFoundException(id));
        if (!subscriber.isActive()) {
            return subscriber;
        }
        Subscriber deactivated = subscriberDirectory.deactivate(id);
        log.info("Subscriber {} deactivated", id);
        notify(messageComposer.composeUnsubscribed(deactivated));
        return deactivated;
    }

    /**
     * Null arguments keep the current value; at least one must be given.
     */
    public Subscriber updatePreferences(String email, String languageCode, String difficultyCode) {
        String id = normalizeEmail(email);
        if (languageCode == null && difficultyCode == null) {
            throw new InvalidPreferenceException("Provide a language, a difficulty, or both.");
        }
        Language language = languageCode == null ? null : parseLanguage(languageCode);
        DifficultyPreference difficulty = difficultyCode == null ? null : parseDifficulty(difficultyCode);

        subscriberDirectory.find(id).orElseThrow(() -> new SubscriberNotFoundException(id));
        Subscriber updated = subscriberDirectory.updatePreferences(id, language, difficulty);
        log.info("Subscriber {} preferences updated - language: {}, difficulty: {}",
                id, updated.getLanguage(), updated.getDifficulty());
        return updated;
    }

    public SubscriberStats stats(String email) {
        String id = normalizeEmail(email);
        Subscriber subscriber = subscriberDirectory.find(id)
                .orElseThrow(() -> new SubscriberNotFoundException(id));

        List<DeliveryRecord> records = deliveryHistory.findBySubscriber(id);
        List<DeliveryRecord> successes = records.stream().filter(DeliveryRecord::isSuccess).toList();

        Map<Difficulty, Long> byDifficulty = new EnumMap<>(Difficulty.class);
        successes.stream()
                .map(r -> problemCatalog.findById(r.getProblemId()))
                .flatMap(Optional::stream)
                .map(Problem::getDifficulty)
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()))
                .forEach(byDifficulty::put);

        Instant lastDelivered = successes.stream()
                .map(DeliveryRecord::getAttemptedAt)
                .max(Instant::compareTo)
                .orElse(null);

        return new SubscriberStats(
                subscriber.getId(),
                subscriber.getLanguage().code(),
                subscriber.getDifficulty().name().toLowerCase(Locale.ROOT),
                subscriber.isActive(),
                subscriber.getCreatedAt(),
                successes.size(),
                records.size() - successes.size(),
                byDifficulty,
                lastDelivered);
    }

    private void notify(OutboundMessage message) {
        try {
            messageSender.send(message);
        } catch (RuntimeException e) {
            log.warn("Could not send notice '{}' to {}: {}", message.subject(), message.to(), e.getMessage());
        }
    }

    private static String normalizeEmail(String email) {
        String trimmed = email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
        if (!EMAIL.matcher(trimmed).matches()) {
            throw new InvalidPreferenceException("Invalid e-mail address: " + email);
        }
        return trimmed;
    }

    private Language parseLanguage(String code) {
        return Language.fromCode(code)
                .filter(supportedLanguages::contains)
                .orElseThrow(() -> new InvalidPreferenceException("Unsupported language: " + code
                        + ". Supported: " + supportedLanguages.stream().map(Language::code).sorted().toList()));
    }

    private static DifficultyPreference parseDifficulty(String code) {
        return DifficultyPreference.fromCode(code)
                .orElseThrow(() -> new InvalidPreferenceException("Unsupported difficulty: " + code
                        + ". Supported: easy, medium, hard, any"));
    }
}
