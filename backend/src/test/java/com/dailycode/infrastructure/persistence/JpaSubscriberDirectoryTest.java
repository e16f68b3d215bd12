package com.dailycode.infrastructure.persistence;

import com.dailycode.domain.subscriber.model.DifficultyPreference;
import com.dailycode.domain.subscriber.model.Language;
import com.dailycode.domain.subscriber.model.Subscriber;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import({JpaSubscriberDirectory.class, JpaSubscriberDirectoryTest.FixedClock.class})
class JpaSubscriberDirectoryTest {

    private static final Instant NOW = Instant.parse("2024-03-01T09:00:00Z");

    @TestConfiguration
    static class FixedClock {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private JpaSubscriberDirectory directory;

    @Test
    @DisplayName("active subscribers are listed by identity")
    void findActive() {
        directory.register("carol@example.com", Language.RUST, DifficultyPreference.HARD);
        directory.register("alice@example.com", Language.PYTHON, DifficultyPreference.EASY);
        directory.register("bob@example.com", Language.JAVA, DifficultyPreference.ANY);
        directory.deactivate("bob@example.com");

        assertThat(directory.findActive())
                .extracting(Subscriber::getId)
                .containsExactly("alice@example.com", "carol@example.com");
        assertThat(directory.countActive()).isEqualTo(2);
    }

    @Test
    @DisplayName("reactivation replaces preferences and keeps the original creation time")
    void reactivate() {
        directory.register("alice@example.com", Language.PYTHON, DifficultyPreference.EASY);
        directory.deactivate("alice@example.com");

        Subscriber reactivated = directory.reactivate("alice@example.com", Language.CPP, DifficultyPreference.MEDIUM);

        assertThat(reactivated.isActive()).isTrue();
        assertThat(reactivated.getLanguage()).isEqualTo(Language.CPP);
        assertThat(reactivated.getDifficulty()).isEqualTo(DifficultyPreference.MEDIUM);
        assertThat(reactivated.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("a partial preference update keeps the other value")
    void updatePreferences() {
        directory.register("alice@example.com", Language.PYTHON, DifficultyPreference.EASY);

        directory.updatePreferences("alice@example.com", Language.GO, null);

        assertThat(directory.find("alice@example.com")).hasValueSatisfying(s -> {
            assertThat(s.getLanguage()).isEqualTo(Language.GO);
            assertThat(s.getDifficulty()).isEqualTo(DifficultyPreference.EASY);
        });
    }
}
