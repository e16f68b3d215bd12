package com.dailycode.interfaces.api.dto;

import com.dailycode.domain.subscriber.model.Subscriber;

import java.time.Instant;
import java.util.Locale;

public record SubscriberResponse(
        String email,
        String language,
        String difficulty,
        boolean active,
        Instant createdAt,
        Instant updatedAt
) {
    public static SubscriberResponse from(Subscriber subscriber) {
        return new SubscriberResponse(
                subscriber.getId(),
                subscriber.getLanguage().code(),
                subscriber.getDifficulty().name().toLowerCase(Locale.ROOT),
                subscriber.isActive(),
                subscriber.getCreatedAt(),
                subscriber.getUpdatedAt());
    }
}
