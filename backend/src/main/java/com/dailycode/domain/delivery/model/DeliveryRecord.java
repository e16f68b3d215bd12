package com.dailycode.domain.delivery.model;

import com.dailycode.domain.subscriber.model.Language;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One delivery attempt. Rows are never updated or deleted.
 */
@Entity
@Table(name = "delivery_history", indexes = {
        @Index(name = "idx_delivery_history_subscriber", columnList = "subscriberId, outcome")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DeliveryRecord {

    private static final int MAX_REASON_LENGTH = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String subscriberId;

    @Column(nullable = false, length = 120)
    private String problemId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Language language;

    @Column(nullable = false, updatable = false)
    private Instant attemptedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private DeliveryOutcome outcome;

    @Column(length = MAX_REASON_LENGTH)
    private String reason;

    private DeliveryRecord(String subscriberId, String problemId, Language language, Instant attemptedAt,
                           DeliveryOutcome outcome, String reason) {
        this.subscriberId = subscriberId;
        this.problemId = problemId;
        this.language = language;
        this.attemptedAt = attemptedAt;
        this.outcome = outcome;
        this.reason = reason;
    }

    public static DeliveryRecord success(String subscriberId, String problemId, Language language, Instant at) {
        return new DeliveryRecord(subscriberId, problemId, language, at, DeliveryOutcome.SUCCESS, null);
    }

    public static DeliveryRecord failure(String subscriberId, String problemId, Language language, Instant at,
                                         String reason) {
        String trimmed = reason != null && reason.length() > MAX_REASON_LENGTH
                ? reason.substring(0, MAX_REASON_LENGTH)
                : reason;
        return new DeliveryRecord(subscriberId, problemId, language, at, DeliveryOutcome.FAILURE, trimmed);
    }

    public boolean isSuccess() {
        return outcome == DeliveryOutcome.SUCCESS;
    }
}
