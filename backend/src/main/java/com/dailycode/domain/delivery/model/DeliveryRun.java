package com.dailycode.domain.delivery.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Marker for a finished delivery run, written even when the run had nobody to deliver to.
 */
@Entity
@Table(name = "delivery_runs")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DeliveryRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 36)
    private String runId;

    @Column(nullable = false, length = 20)
    private String source;

    @Column(nullable = false, updatable = false)
    private Instant startedAt;

    @Column(nullable = false, updatable = false)
    private Instant finishedAt;

    private int subscribers;

    private int sent;

    @Builder
    private DeliveryRun(String runId, String source, Instant startedAt, Instant finishedAt, int subscribers,
                        int sent) {
        this.runId = runId;
        this.source = source;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.subscribers = subscribers;
        this.sent = sent;
    }
}
