package com.dailycode.domain.subscriber.service;

import com.dailycode.domain.subscriber.model.DifficultyPreference;
import com.dailycode.domain.subscriber.model.Language;
import com.dailycode.domain.subscriber.model.Subscriber;

import java.util.List;
import java.util.Optional;

/**
 * Subscriber identities with their preferences and active status.
 * All methods throw {@code DirectoryUnavailableException} when the backing store cannot be reached.
 */
public interface SubscriberDirectory {

    /**
     * Active subscribers ordered by identity.
     */
    List<Subscriber> findActive();

    Optional<Subscriber> find(String subscriberId);

    Subscriber register(String subscriberId, Language language, DifficultyPreference difficulty);

    /**
     * Reactivates an existing identity and replaces its preferences.
     */
    Subscriber reactivate(String subscriberId, Language language, DifficultyPreference difficulty);

    Subscriber deactivate(String subscriberId);

    Subscriber updatePreferences(String subscriberId, Language language, DifficultyPreference difficulty);

    long countActive();
}
