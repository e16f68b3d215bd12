package com.dailycode.application.subscription;

import com.dailycode.application.subscription.exception.AlreadySubscribedException;
import com.dailycode.application.subscription.exception.InvalidPreferenceException;
import com.dailycode.application.subscription.exception.SubscriberNotFoundException;
import com.dailycode.domain.delivery.exception.SendException;
import com.dailycode.domain.delivery.model.DeliveryRecord;
import com.dailycode.domain.delivery.model.OutboundMessage;
import com.dailycode.domain.delivery.service.DeliveryHistory;
import com.dailycode.domain.delivery.service.MessageSender;
import com.dailycode.domain.problem.model.Difficulty;
import com.dailycode.domain.problem.service.ProblemCatalog;
import com.dailycode.domain.subscriber.model.DifficultyPreference;
import com.dailycode.domain.subscriber.model.Language;
import com.dailycode.domain.subscriber.model.Subscriber;
import com.dailycode.domain.subscriber.service.SubscriberDirectory;
import com.dailycode.infrastructure.email.MessageComposer;
import com.dailycode.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static com.dailycode.support.Fixtures.problem;
import static com.dailycode.support.Fixtures.subscriber;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SubscriptionServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T09:00:00Z"), ZoneOffset.UTC);

    @Mock
    private SubscriberDirectory subscriberDirectory;

    @Mock
    private DeliveryHistory deliveryHistory;

    @Mock
    private ProblemCatalog problemCatalog;

    @Mock
    private MessageSender messageSender;

    private SubscriptionService service;

    @BeforeEach
    void setUp() {
        service = new SubscriptionService(subscriberDirectory, deliveryHistory, problemCatalog,
                new MessageComposer(CLOCK, TestProperties.defaults()), messageSender, TestProperties.defaults());
    }

    @Nested
    @DisplayName("subscribe")
    class Subscribe {

        @Test
        @DisplayName("registers a new identity with defaults and sends a welcome")
        void registersWithDefaults() {
            Subscriber registered = subscriber("alice@example.com", Language.PYTHON, DifficultyPreference.EASY);
            when(subscriberDirectory.find("alice@example.com")).thenReturn(Optional.empty());
            when(subscriberDirectory.register("alice@example.com", Language.PYTHON, DifficultyPreference.EASY))
                    .thenReturn(registered);

            SubscriptionResult result = service.subscribe("  Alice@Example.com ", null, null);

            assertThat(result.reactivated()).isFalse();
            assertThat(result.subscriber()).isSameAs(registered);
            ArgumentCaptor<OutboundMessage> welcome = ArgumentCaptor.forClass(OutboundMessage.class);
            verify(messageSender).send(welcome.capture());
            assertThat(welcome.getValue().subject()).contains("Welcome");
        }

        @Test
        @DisplayName("an active identity cannot subscribe twice")
        void alreadyActive() {
            when(subscriberDirectory.find("alice@example.com"))
                    .thenReturn(Optional.of(subscriber("alice@example.com", DifficultyPreference.EASY)));

            assertThatThrownBy(() -> service.subscribe("alice@example.com", "java", "medium"))
                    .isInstanceOf(AlreadySubscribedException.class);
            verify(subscriberDirectory, never()).register(any(), any(), any());
            verifyNoInteractions(messageSender);
        }

        @Test
        @DisplayName("an inactive identity is reactivated with the new preferences")
        void reactivates() {
            Subscriber inactive = subscriber("alice@example.com", DifficultyPreference.EASY);
            inactive.deactivate(CLOCK.instant());
            Subscriber reactivated = subscriber("alice@example.com", Language.GO, DifficultyPreference.HARD);
            when(subscriberDirectory.find("alice@example.com")).thenReturn(Optional.of(inactive));
            when(subscriberDirectory.reactivate("alice@example.com", Language.GO, DifficultyPreference.HARD))
                    .thenReturn(reactivated);

            SubscriptionResult result = service.subscribe("alice@example.com", "go", "hard");

            assertThat(result.reactivated()).isTrue();
            assertThat(result.subscriber().getLanguage()).isEqualTo(Language.GO);
        }

        @Test
        @DisplayName("a failing welcome message does not fail the subscription")
        void welcomeIsBestEffort() {
            when(subscriberDirectory.find("alice@example.com")).thenReturn(Optional.empty());
            when(subscriberDirectory.register("alice@example.com", Language.JAVA, DifficultyPreference.ANY))
                    .thenReturn(subscriber("alice@example.com", Language.JAVA, DifficultyPreference.ANY));
            doThrow(new SendException("smtp down")).when(messageSender).send(any());

            SubscriptionResult result = service.subscribe("alice@example.com", "java", "any");

            assertThat(result.subscriber().getDifficulty()).isEqualTo(DifficultyPreference.ANY);
        }

        @Test
        @DisplayName("rejects malformed addresses, unknown languages and unknown difficulties")
        void validation() {
            assertThatThrownBy(() -> service.subscribe("not-an-email", null, null))
                    .isInstanceOf(InvalidPreferenceException.class);
            assertThatThrownBy(() -> service.subscribe("alice@example.com", "cobol", null))
                    .isInstanceOf(InvalidPreferenceException.class)
                    .hasMessageContaining("Unsupported language: cobol");
            assertThatThrownBy(() -> service.subscribe("alice@example.com", null, "insane"))
                    .isInstanceOf(InvalidPreferenceException.class)
                    .hasMessageContaining("Unsupported difficulty: insane");
            verifyNoInteractions(subscriberDirectory);
        }
    }

    @Nested
    @DisplayName("unsubscribe")
    class Unsubscribe {

        @Test
        @DisplayName("deactivates and keeps history")
        void deactivates() {
            Subscriber active = subscriber("alice@example.com", DifficultyPreference.EASY);
            Subscriber inactive = subscriber("alice@example.com", DifficultyPreference.EASY);
            inactive.deactivate(CLOCK.instant());
            when(subscriberDirectory.find("alice@example.com")).thenReturn(Optional.of(active));
            when(subscriberDirectory.deactivate("alice@example.com")).thenReturn(inactive);

            Subscriber result = service.unsubscribe("alice@example.com");

            assertThat(result.isActive()).isFalse();
            verify(messageSender).send(any());
            verifyNoInteractions(deliveryHistory);
        }

        @Test
        @DisplayName("an unknown identity is reported as not found")
        void unknown() {
            when(subscriberDirectory.find("ghost@example.com")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.unsubscribe("ghost@example.com"))
                    .isInstanceOf(SubscriberNotFoundException.class);
        }

        @Test
        @DisplayName("unsubscribing an inactive identity is a no-op")
        void alreadyInactive() {
            Subscriber inactive = subscriber("alice@example.com", DifficultyPreference.EASY);
            inactive.deactivate(CLOCK.instant());
            when(subscriberDirectory.find("alice@example.com")).thenReturn(Optional.of(inactive));

            service.unsubscribe("alice@example.com");

            verify(subscriberDirectory, never()).deactivate(any());
            verifyNoInteractions(messageSender);
        }
    }

    @Nested
    @DisplayName("updatePreferences")
    class UpdatePreferences {

        @Test
        @DisplayName("changes only the given preference")
        void partialUpdate() {
            Subscriber existing = subscriber("alice@example.com", DifficultyPreference.EASY);
            Subscriber updated = subscriber("alice@example.com", Language.PYTHON, DifficultyPreference.MEDIUM);
            when(subscriberDirectory.find("alice@example.com")).thenReturn(Optional.of(existing));
            when(subscriberDirectory.updatePreferences("alice@example.com", null, DifficultyPreference.MEDIUM))
                    .thenReturn(updated);

            Subscriber result = service.updatePreferences("alice@example.com", null, "medium");

            assertThat(result.getDifficulty()).isEqualTo(DifficultyPreference.MEDIUM);
        }

        @Test
        @DisplayName("requires at least one preference")
        void nothingToUpdate() {
            assertThatThrownBy(() -> service.updatePreferences("alice@example.com", null, null))
                    .isInstanceOf(InvalidPreferenceException.class);
        }
    }

    @Test
    @DisplayName("stats count deliveries and failures, grouping by difficulty only problems still in the catalog")
    void stats() {
        Subscriber alice = subscriber("alice@example.com", DifficultyPreference.ANY);
        Instant first = Instant.parse("2024-02-01T09:00:00Z");
        Instant second = Instant.parse("2024-02-02T09:00:00Z");
        when(subscriberDirectory.find("alice@example.com")).thenReturn(Optional.of(alice));
        when(deliveryHistory.findBySubscriber("alice@example.com")).thenReturn(List.of(
                DeliveryRecord.success("alice@example.com", "two-sum", Language.PYTHON, first),
                DeliveryRecord.failure("alice@example.com", "merge-intervals", Language.PYTHON, second, "send: x"),
                DeliveryRecord.success("alice@example.com", "merge-intervals", Language.PYTHON, second),
                DeliveryRecord.success("alice@example.com", "retired-problem", Language.PYTHON, first)));
        when(problemCatalog.findById("two-sum")).thenReturn(Optional.of(problem("two-sum", Difficulty.EASY)));
        when(problemCatalog.findById("merge-intervals"))
                .thenReturn(Optional.of(problem("merge-intervals", Difficulty.MEDIUM)));
        when(problemCatalog.findById("retired-problem")).thenReturn(Optional.empty());

        SubscriberStats stats = service.stats("alice@example.com");

        assertThat(stats.totalDelivered()).isEqualTo(3);
        assertThat(stats.failedAttempts()).isEqualTo(1);
        assertThat(stats.deliveredByDifficulty())
                .containsEntry(Difficulty.EASY, 1L)
                .containsEntry(Difficulty.MEDIUM, 1L)
                .doesNotContainKey(Difficulty.HARD);
        assertThat(stats.lastDeliveredAt()).isEqualTo(second);
        assertThat(stats.language()).isEqualTo("python");
        assertThat(stats.difficulty()).isEqualTo("any");
    }
}
