package com.dailycode.domain.subscriber.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "subscribers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Subscriber {

    @Id
    @Column(length = 255)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Language language;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private DifficultyPreference difficulty;

    @Column(nullable = false)
    private boolean active;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @Builder
    public Subscriber(String id, Language language, DifficultyPreference difficulty, Instant createdAt) {
        this.id = id;
        this.language = language;
        this.difficulty = difficulty;
        this.active = true;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public void activate(Instant at) {
        this.active = true;
        this.updatedAt = at;
    }

    public void deactivate(Instant at) {
        this.active = false;
        this.updatedAt = at;
    }

    /**
     * Null arguments keep the current value.
     */
    public void updatePreferences(Language language, DifficultyPreference difficulty, Instant at) {
        if (language != null) {
            this.language = language;
        }
        if (difficulty != null) {
            this.difficulty = difficulty;
        }
        this.updatedAt = at;
    }

    /**
     * Local part of the e-mail address, used as a greeting name.
     */
    public String displayName() {
        int at = id.indexOf('@');
        return at > 0 ? id.substring(0, at) : id;
    }
}
